package org.bimrelay.ifc.dto.express;

/**
 * 单条 IFC 实体片段。
 *
 * @param id             实体实例 id
 * @param type           实体类型名
 * @param line           行号
 * @param parameterCount 顶层参数个数
 * @param text           实体原文
 */
public record IfcEntitySnippet(
        int id,
        String type,
        int line,
        int parameterCount,
        String text
) {
}
