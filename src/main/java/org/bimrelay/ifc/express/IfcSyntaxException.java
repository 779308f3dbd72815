package org.bimrelay.ifc.express;

/**
 * 无法从输入中切分出 DATA 段时抛出。
 */
public class IfcSyntaxException extends Exception {

    public IfcSyntaxException(String message) {
        super(message);
    }
}
