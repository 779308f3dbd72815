package org.bimrelay.ifc.express;

/**
 * 空值占位 {@code $}。
 */
public record IfcNull() implements IfcValue {

    public static final IfcNull INSTANCE = new IfcNull();
}
