package org.bimrelay.ifc.express;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 定位 {@code DATA; ... ENDSEC;} 区域并切分成行。
 * <p>
 * IFC 物理文件结构：
 * <pre>
 * ISO-10303-21;
 * HEADER; ... ENDSEC;
 * DATA;   ... ENDSEC;
 * END-ISO-10303-21;
 * </pre>
 * 段标记只在行首识别且区分大小写，HEADER 字符串里的 {@code 'data;'} 不会被当成 DATA 段开始；
 * 存在 HEADER 段时从它的 ENDSEC 之后开始查找。
 * 行号按原始输入计算（空行、注释行虽然被丢弃，但不影响后续行号）。
 */
public final class DataSectionExtractor {

    static final Pattern HEADER_START = Pattern.compile("(?m)^[ \\t]*HEADER[ \\t]*;");
    static final Pattern DATA_START = Pattern.compile("(?m)^[ \\t]*DATA[ \\t]*;");
    static final Pattern ENDSEC = Pattern.compile("(?m)^[ \\t]*ENDSEC[ \\t]*;");

    private DataSectionExtractor() {
    }

    public static List<SourceLine> extract(String content) throws IfcSyntaxException {
        if (content == null) {
            throw new IfcSyntaxException("DATA section not found");
        }
        Matcher start = findMarker(DATA_START, content, headerEnd(content));
        Matcher end = start == null ? null : findMarker(ENDSEC, content, start.end());
        if (end == null) {
            throw new IfcSyntaxException("DATA section not found");
        }

        int lineNumber = 1 + countLineBreaks(content, 0, start.end());
        String[] rawLines = content.substring(start.end(), end.start()).split("\n", -1);
        List<SourceLine> lines = new ArrayList<>(rawLines.length);
        for (String rawLine : rawLines) {
            String text = rawLine.trim();
            if (!text.isEmpty() && !isComment(text)) {
                lines.add(new SourceLine(lineNumber, text));
            }
            lineNumber++;
        }
        return lines;
    }

    /**
     * 从 {@code from} 开始查找行首段标记；{@code ^} 按整段文本判断行首，而不是按查找起点。
     */
    static Matcher findMarker(Pattern marker, String content, int from) {
        Matcher m = marker.matcher(content);
        m.useAnchoringBounds(false);
        m.region(from, content.length());
        return m.find() ? m : null;
    }

    private static int headerEnd(String content) {
        Matcher header = findMarker(HEADER_START, content, 0);
        Matcher end = header == null ? null : findMarker(ENDSEC, content, header.end());
        return end == null ? 0 : end.end();
    }

    private static boolean isComment(String text) {
        return text.startsWith("/*") && text.endsWith("*/");
    }

    private static int countLineBreaks(String text, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
