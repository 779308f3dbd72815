package org.bimrelay.ifc.express;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 实体参数表解析器：按最外层逗号切分，并把每个参数归类为 {@link IfcValue}。
 * <p>
 * 切分规则：
 * <ul>
 *   <li>只在括号深度为 0、且不在字符串内时按 ',' 切分；嵌套列表与字符串内的逗号原样保留</li>
 *   <li>未转义的 {@code '} 切换字符串状态；{@code ''} 相当于连续两次切换，效果上仍在字符串内</li>
 *   <li>反斜杠使下一个字符原样通过、不切换字符串状态；{@code \X2\}、{@code \X0\} 等控制指令整体通过，
 *       因此 {@code '\X2\4E2D\X0\'} 的结尾引号仍然会关闭字符串</li>
 * </ul>
 * 字符串或列表未闭合（以及多余的 ')'）时在行尾强制收尾，并通过 {@link Parameters#unterminated()} 告知调用方。
 */
public final class ParameterParser {

    private static final Pattern REFERENCE = Pattern.compile("#(\\d+)");
    private static final Pattern NUMBER = Pattern.compile("[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private ParameterParser() {
    }

    /**
     * @param values       参数值（顺序与原文一致）
     * @param unterminated 是否存在未闭合的字符串/列表或不匹配的括号
     */
    public record Parameters(List<IfcValue> values, boolean unterminated) {
        public Parameters {
            values = List.copyOf(values);
        }
    }

    public static Parameters parse(String paramText) {
        if (paramText == null || paramText.isBlank()) {
            return new Parameters(List.of(), false);
        }

        List<IfcValue> values = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean inString = false;
        boolean unbalanced = false;

        int len = paramText.length();
        for (int i = 0; i < len; i++) {
            char c = paramText.charAt(i);

            if (c == '\\') {
                int directive = StepStrings.directiveLength(paramText, i);
                int consumed = directive > 0 ? directive : Math.min(2, len - i);
                current.append(paramText, i, i + consumed);
                i += consumed - 1;
                continue;
            }
            if (c == '\'') {
                inString = !inString;
                current.append(c);
                continue;
            }
            if (inString) {
                current.append(c);
                continue;
            }

            if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    unbalanced = true;
                } else {
                    depth--;
                }
            } else if (c == ',' && depth == 0) {
                values.add(classify(current.toString().trim()));
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        values.add(classify(current.toString().trim()));

        return new Parameters(values, inString || depth > 0 || unbalanced);
    }

    /**
     * 单个参数归类：{@code #digits} 为引用，{@code $} 为空值，数值字面量为数字，其余按原文作为字符串。
     */
    public static IfcValue classify(String token) {
        if ("$".equals(token)) {
            return IfcNull.INSTANCE;
        }
        if (REFERENCE.matcher(token).matches()) {
            try {
                return new IfcRef(Integer.parseInt(token.substring(1)));
            } catch (NumberFormatException e) {
                // 超出 int 范围的 id 不可能被解析成实体，保留原文
                return new IfcString(token);
            }
        }
        if (NUMBER.matcher(token).matches()) {
            return new IfcNumber(token, Double.parseDouble(token));
        }
        return new IfcString(token);
    }
}
