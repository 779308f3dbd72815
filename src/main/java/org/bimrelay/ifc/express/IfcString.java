package org.bimrelay.ifc.express;

/**
 * 字符串类参数（按原文保存，包括引号）。
 * <p>
 * 除了 {@code 'text'} 字面量，枚举 {@code .T.}、嵌套列表 {@code (#1,#2)}、带类型值 {@code IFCLABEL('x')}
 * 以及 {@code *} 等无法归类的参数也落在这里。
 *
 * @param raw 参数原文（已去掉首尾空白）
 */
public record IfcString(String raw) implements IfcValue {

    /**
     * 是否为单引号包围的字符串字面量。
     */
    public boolean isQuoted() {
        return raw.length() >= 2 && raw.charAt(0) == '\'' && raw.charAt(raw.length() - 1) == '\'';
    }

    /**
     * 字面量的实际文本：去掉首尾引号，{@code ''} 还原为 {@code '}，并解码 {@code \X2\...\X0\} 等转义。
     * 非字面量原样返回。
     */
    public String text() {
        if (!isQuoted()) {
            return raw;
        }
        return StepStrings.decode(raw.substring(1, raw.length() - 1).replace("''", "'"));
    }
}
