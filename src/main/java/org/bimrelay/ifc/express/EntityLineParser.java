package org.bimrelay.ifc.express;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单行实体解析：{@code #<id>=<TYPE>(<params>);}。
 * <p>
 * 不匹配的行直接跳过（DATA 段允许出现杂项内容，不算错误）。
 */
public final class EntityLineParser {

    private static final Pattern ENTITY = Pattern.compile("^#(\\d+)\\s*=\\s*([A-Z][A-Z0-9_]*)\\s*\\((.*)\\)\\s*;$");

    private EntityLineParser() {
    }

    /**
     * @param line     DATA 段中的一行
     * @param warnings 非致命问题（参数未闭合、id 越界）追加到这里
     * @return 解析出的实体；不是实体行时返回 null
     */
    public static IfcEntity parse(SourceLine line, List<Finding> warnings) {
        Matcher m = ENTITY.matcher(line.text());
        if (!m.matches()) {
            return null;
        }

        int id;
        try {
            id = Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            warnings.add(new Finding(FindingKind.SYNTAX, Severity.WARNING, null, line.number(),
                    "Entity id out of range: #" + m.group(1)));
            return null;
        }

        ParameterParser.Parameters parameters = ParameterParser.parse(m.group(3));
        IfcEntity entity = new IfcEntity(id, m.group(2), parameters.values(), line.text(), line.number());
        if (parameters.unterminated()) {
            warnings.add(Finding.warning(FindingKind.SYNTAX, entity,
                    "Unterminated string or list in parameters of #" + id));
        }
        return entity;
    }
}
