package org.bimrelay.ifc.express;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IFC HEADER 段解析（尽力而为）。
 * <p>
 * 只读取 HEADER 内的三条语句：
 * <ul>
 *   <li>{@code FILE_DESCRIPTION((description_list), 'implementation_level')}</li>
 *   <li>{@code FILE_NAME(name, time_stamp, (author), (organization), preprocessor, originating_system, authorization)}</li>
 *   <li>{@code FILE_SCHEMA(('IFC2X3'))}</li>
 * </ul>
 * 语句参数与 DATA 段实体参数走同一个 {@link ParameterParser}，字符串统一由 {@link IfcString#text()} 解码。
 * 缺失的部分写入 warnings，不抛异常。校验器本身忽略 HEADER。
 */
public final class IfcHeaderParser {

    private static final String FILE_DESCRIPTION = "FILE_DESCRIPTION";
    private static final String FILE_NAME = "FILE_NAME";
    private static final String FILE_SCHEMA = "FILE_SCHEMA";

    // 语句从行首开始，到行尾的 ");" 结束，允许跨行
    private static final Pattern STATEMENT = Pattern.compile(
            "(?ms)^[ \\t]*(FILE_DESCRIPTION|FILE_NAME|FILE_SCHEMA)[ \\t]*\\((.*?)\\)[ \\t]*;[ \\t]*$");

    private IfcHeaderParser() {
    }

    public record IfcHeader(
            List<String> fileDescriptions,
            String implementationLevel,
            String fileName,
            String timeStamp,
            List<String> authors,
            List<String> organizations,
            String preprocessorVersion,
            String originatingSystem,
            String authorization,
            List<String> schemas,
            List<String> warnings
    ) {
    }

    public static IfcHeader parse(String text) {
        List<String> warnings = new ArrayList<>();
        String section = (text == null || text.isBlank()) ? null : headerSection(text, warnings);
        if (section == null) {
            if (warnings.isEmpty()) {
                warnings.add("内容为空，没有可读取的 HEADER。");
            }
            return new IfcHeader(null, null, null, null, null, null, null, null, null, null, warnings);
        }

        Map<String, List<IfcValue>> statements = new HashMap<>();
        Matcher m = STATEMENT.matcher(section);
        while (m.find()) {
            statements.putIfAbsent(m.group(1), ParameterParser.parse(m.group(2)).values());
        }
        List<IfcValue> description = statement(statements, FILE_DESCRIPTION, warnings);
        List<IfcValue> name = statement(statements, FILE_NAME, warnings);
        List<IfcValue> schema = statement(statements, FILE_SCHEMA, warnings);

        return new IfcHeader(
                texts(param(description, 0)),
                text(param(description, 1)),
                text(param(name, 0)),
                text(param(name, 1)),
                texts(param(name, 2)),
                texts(param(name, 3)),
                text(param(name, 4)),
                text(param(name, 5)),
                text(param(name, 6)),
                texts(param(schema, 0)),
                warnings.isEmpty() ? null : warnings
        );
    }

    private static String headerSection(String text, List<String> warnings) {
        Matcher start = DataSectionExtractor.findMarker(DataSectionExtractor.HEADER_START, text, 0);
        if (start == null) {
            warnings.add("缺少 HEADER 段（HEADER; ... ENDSEC;），可能不是 IFC 物理文件。");
            return null;
        }
        Matcher end = DataSectionExtractor.findMarker(DataSectionExtractor.ENDSEC, text, start.end());
        if (end == null) {
            warnings.add("HEADER 段没有以 ENDSEC; 结束，按文件剩余部分读取。");
            return text.substring(start.end());
        }
        return text.substring(start.end(), end.start());
    }

    private static List<IfcValue> statement(Map<String, List<IfcValue>> statements, String keyword, List<String> warnings) {
        List<IfcValue> params = statements.get(keyword);
        if (params == null) {
            warnings.add("HEADER 中没有 " + keyword + " 语句。");
        }
        return params;
    }

    private static IfcValue param(List<IfcValue> params, int index) {
        return (params == null || index >= params.size()) ? null : params.get(index);
    }

    /**
     * 单个字符串参数；{@code $}、空串或非字符串返回 null。
     */
    private static String text(IfcValue value) {
        if (value instanceof IfcString s && s.isQuoted()) {
            String decoded = s.text();
            return decoded.isBlank() ? null : decoded;
        }
        return null;
    }

    /**
     * 字符串列表参数 {@code ('a','b')}；空串元素被忽略，没有元素时返回 null。
     */
    private static List<String> texts(IfcValue value) {
        if (!(value instanceof IfcString s)) {
            return null;
        }
        String raw = s.raw();
        List<IfcValue> items = (raw.length() >= 2 && raw.startsWith("(") && raw.endsWith(")"))
                ? ParameterParser.parse(raw.substring(1, raw.length() - 1)).values()
                : List.of(value);
        List<String> out = new ArrayList<>(items.size());
        for (IfcValue item : items) {
            String decoded = text(item);
            if (decoded != null) {
                out.add(decoded);
            }
        }
        return out.isEmpty() ? null : out;
    }
}
