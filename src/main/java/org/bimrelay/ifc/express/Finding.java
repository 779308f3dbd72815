package org.bimrelay.ifc.express;

/**
 * 一条校验发现（错误或告警）。告警与错误是同一类型，仅 {@link #severity} 不同。
 *
 * @param kind     问题类别
 * @param severity 严重程度
 * @param entity   关联实体（可为空）
 * @param line     行号（可为空）
 * @param message  描述
 */
public record Finding(
        FindingKind kind,
        Severity severity,
        IfcEntity entity,
        Integer line,
        String message
) {

    public static Finding error(FindingKind kind, IfcEntity entity, String message) {
        return new Finding(kind, Severity.ERROR, entity, entity == null ? null : entity.line(), message);
    }

    public static Finding warning(FindingKind kind, IfcEntity entity, String message) {
        return new Finding(kind, Severity.WARNING, entity, entity == null ? null : entity.line(), message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }
}
