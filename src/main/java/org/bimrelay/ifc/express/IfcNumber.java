package org.bimrelay.ifc.express;

/**
 * 数值参数，例如 {@code 3.14}、{@code -2}、{@code 0.}、{@code 1.E-5}。
 *
 * @param raw   原文
 * @param value 解析后的数值
 */
public record IfcNumber(String raw, double value) implements IfcValue {
}
