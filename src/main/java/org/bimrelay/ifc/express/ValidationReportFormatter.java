package org.bimrelay.ifc.express;

import java.util.List;
import java.util.Map;

/**
 * 把 {@link ValidationResult} 渲染为固定顺序的多行文本（字段顺序是输出契约的一部分）：
 * 有效性、实体数、类型数、类型分布、引用计数、逐条错误、逐条告警。
 */
public final class ValidationReportFormatter {

    private ValidationReportFormatter() {
    }

    public static String format(ValidationResult result) {
        return format(result, Integer.MAX_VALUE);
    }

    /**
     * @param maxFindings errors/warnings 各自最多渲染多少条，超出部分以一行汇总代替
     */
    public static String format(ValidationResult result, int maxFindings) {
        ValidationStats stats = result.stats();
        StringBuilder out = new StringBuilder(256);
        out.append("IFC validation report\n");
        out.append("Valid: ").append(result.isValid()).append('\n');
        out.append("Total entities: ").append(stats.totalEntities()).append('\n');
        out.append("Unique types: ").append(stats.uniqueTypes()).append('\n');
        out.append("Entity counts:\n");
        for (Map.Entry<String, Integer> e : stats.entityCounts().entrySet()) {
            out.append("  ").append(e.getKey()).append(": ").append(e.getValue()).append('\n');
        }
        ReferenceCounts refs = stats.referenceCounts();
        out.append("References: total=").append(refs.total())
                .append(", resolved=").append(refs.resolved())
                .append(", broken=").append(refs.broken()).append('\n');
        appendFindings(out, "Errors", result.errors(), maxFindings);
        appendFindings(out, "Warnings", result.warnings(), maxFindings);
        return out.toString();
    }

    public static String formatFinding(Finding finding) {
        StringBuilder out = new StringBuilder();
        out.append('[').append(finding.kind()).append(']');
        if (finding.line() != null) {
            out.append(" line ").append(finding.line());
        }
        if (finding.entity() != null) {
            out.append(" #").append(finding.entity().id());
        }
        out.append(": ").append(finding.message());
        return out.toString();
    }

    private static void appendFindings(StringBuilder out, String title, List<Finding> findings, int maxFindings) {
        out.append(title).append(" (").append(findings.size()).append("):\n");
        int limit = Math.max(0, maxFindings);
        for (int i = 0; i < findings.size() && i < limit; i++) {
            out.append("  ").append(formatFinding(findings.get(i))).append('\n');
        }
        if (findings.size() > limit) {
            out.append("  ... ").append(findings.size() - limit).append(" more\n");
        }
    }
}
