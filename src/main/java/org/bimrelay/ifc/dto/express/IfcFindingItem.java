package org.bimrelay.ifc.dto.express;

/**
 * 单条校验发现（扁平化，便于 JSON 输出）。
 *
 * @param kind       SYNTAX / SCHEMA / SEMANTIC
 * @param severity   ERROR / WARNING
 * @param entityId   关联实体 id（可为空）
 * @param entityType 关联实体类型（可为空）
 * @param line       行号（可为空）
 * @param message    描述
 */
public record IfcFindingItem(
        String kind,
        String severity,
        Integer entityId,
        String entityType,
        Integer line,
        String message
) {
}
