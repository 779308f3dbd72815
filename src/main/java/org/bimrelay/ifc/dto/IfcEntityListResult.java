package org.bimrelay.ifc.dto;

import org.bimrelay.ifc.dto.express.IfcEntitySnippet;

import java.util.List;

/**
 * {@code ifc_list_entities} 的返回结果（DATA 段实体分页列表）。
 *
 * @param rootId        根目录标识
 * @param path          文件路径（'/' 分隔）
 * @param truncated     是否因 maxBytes 只读取了文件前半段
 * @param decodedWith   解码字符集
 * @param totalEntities 实体总数（重复 id 只计一次）
 * @param matched       满足过滤条件的实体数
 * @param offset        匹配偏移（0-based）
 * @param limit         返回上限
 * @param hasMore       是否还有更多匹配项
 * @param nextOffset    hasMore=true 时下一页的 offset
 * @param entities      实体片段
 * @param warnings      非致命告警
 */
public record IfcEntityListResult(
        String rootId,
        String path,
        boolean truncated,
        String decodedWith,
        int totalEntities,
        int matched,
        int offset,
        int limit,
        boolean hasMore,
        Integer nextOffset,
        List<IfcEntitySnippet> entities,
        List<String> warnings
) {
}
