package org.bimrelay.ifc.express;

/**
 * DATA 段实体参数值。
 * <p>
 * 取值只有四种：{@link IfcString}、{@link IfcNumber}、{@link IfcRef}、{@link IfcNull}。
 * 嵌套列表 {@code (a,b)}、枚举 {@code .ELEMENT.}、带类型值 {@code IFCLABEL('x')} 都按原文保存为 {@link IfcString}。
 */
public interface IfcValue {
}
