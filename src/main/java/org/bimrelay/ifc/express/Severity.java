package org.bimrelay.ifc.express;

public enum Severity {
    ERROR,
    WARNING
}
