package org.bimrelay.ifc.express;

/**
 * ISO 10303-21 字符串控制指令。
 * <p>
 * 支持的指令：
 * <ul>
 *   <li>{@code \X2\...\X0\}：UCS-2，每 4 位十六进制一个 16-bit code unit</li>
 *   <li>{@code \X4\...\X0\}：UCS-4，每 8 位十六进制一个 code point</li>
 *   <li>{@code \X\hh}：ISO-8859-1 单字节，例如 {@code EPIT\X\C1CIO}</li>
 *   <li>{@code \S\c}：当前代码页的高半区字符（c + 0x80）；只支持默认代码页 {@code \PA\}</li>
 *   <li>{@code \\}：一个反斜杠</li>
 * </ul>
 * 格式不正确的指令原样保留。
 */
final class StepStrings {

    private static final String END_EXTENDED = "\\X0\\";

    private StepStrings() {
    }

    /**
     * 返回从 {@code index} 开始的控制指令长度（{@code \X2\}、{@code \X4\}、{@code \X0\}、{@code \X\hh}、
     * {@code \S\c}、{@code \Px\}）；不是控制指令时返回 0。
     */
    static int directiveLength(String text, int index) {
        if (index + 3 >= text.length() || text.charAt(index) != '\\') {
            return 0;
        }
        char d = text.charAt(index + 1);
        char mode = text.charAt(index + 2);
        char next = text.charAt(index + 3);
        switch (d) {
            case 'X':
                if ((mode == '2' || mode == '4' || mode == '0') && next == '\\') {
                    return 4;
                }
                if (mode == '\\' && index + 4 < text.length()
                        && Character.digit(next, 16) >= 0 && Character.digit(text.charAt(index + 4), 16) >= 0) {
                    return 5;
                }
                return 0;
            case 'S':
                return mode == '\\' ? 4 : 0;
            case 'P':
                return (mode >= 'A' && mode <= 'I' && next == '\\') ? 4 : 0;
            default:
                return 0;
        }
    }

    /**
     * 解码字面量内容（引号已去掉、{@code ''} 已还原）中的控制指令。
     */
    static String decode(String value) {
        if (value == null || value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            if (value.startsWith("\\\\", i)) {
                out.append('\\');
                i += 2;
                continue;
            }
            int length = directiveLength(value, i);
            if (length == 0) {
                out.append(value.charAt(i++));
                continue;
            }
            char d = value.charAt(i + 1);
            char mode = value.charAt(i + 2);
            if (d == 'X' && length == 5) {
                out.append((char) Integer.parseInt(value.substring(i + 3, i + 5), 16));
            } else if (d == 'X' && mode != '0') {
                int close = value.indexOf(END_EXTENDED, i + length);
                String decoded = close < 0 ? null : decodeHexRun(value.substring(i + length, close), mode == '4' ? 8 : 4);
                if (decoded != null) {
                    out.append(decoded);
                    i = close + END_EXTENDED.length();
                    continue;
                }
                out.append(value, i, i + length);
            } else if (d == 'S') {
                out.append((char) (value.charAt(i + 3) + 0x80));
            } else if (d != 'P' || mode != 'A') {
                // 只认识默认代码页；其它代码页切换与孤立的 \X0\ 保留原文
                out.append(value, i, i + length);
            }
            i += length;
        }
        return out.toString();
    }

    /**
     * 按固定宽度解码十六进制串；宽度 4 产出 UTF-16 code unit，宽度 8 产出 code point。
     * 长度不是宽度的整数倍、含非十六进制字符或 code point 越界时返回 null。
     */
    private static String decodeHexRun(String hex, int width) {
        if (hex.length() % width != 0) {
            return null;
        }
        StringBuilder out = new StringBuilder(hex.length() / width * 2);
        for (int start = 0; start < hex.length(); start += width) {
            int value = 0;
            for (int k = start; k < start + width; k++) {
                int digit = Character.digit(hex.charAt(k), 16);
                if (digit < 0) {
                    return null;
                }
                value = (value << 4) | digit;
            }
            if (width == 4) {
                out.append((char) value);
            } else if (Character.isValidCodePoint(value)) {
                out.appendCodePoint(value);
            } else {
                return null;
            }
        }
        return out.toString();
    }
}
