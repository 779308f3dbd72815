package org.bimrelay.ifc.express;

/**
 * DATA 段中的一行（已去掉首尾空白）。
 *
 * @param number 在输入文本中的行号（1-based）
 * @param text   行文本
 */
public record SourceLine(int number, String text) {
}
