package org.bimrelay.ifc.express;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * DATA 段统计。
 *
 * @param totalEntities   实体数量（重复 id 只计一次）
 * @param uniqueTypes     不同实体类型数量
 * @param entityCounts    每种类型的实例数（按类型名排序）
 * @param referenceCounts 引用计数
 */
public record ValidationStats(
        int totalEntities,
        int uniqueTypes,
        Map<String, Integer> entityCounts,
        ReferenceCounts referenceCounts
) {
    public ValidationStats {
        entityCounts = Collections.unmodifiableMap(new TreeMap<>(entityCounts));
    }

    public static ValidationStats empty() {
        return new ValidationStats(0, 0, Map.of(), ReferenceCounts.ZERO);
    }
}
