package org.bimrelay.ifc.express;

import java.util.HashMap;
import java.util.Map;

/**
 * 单次遍历实体图，生成 {@link ValidationStats}。
 * <p>
 * 引用在这里通过 {@link EntityGraph#resolve(IfcRef)} 解析，用于区分 resolved/broken；实体图本身不被修改。
 */
public final class StatisticsCollector {

    private StatisticsCollector() {
    }

    public static ValidationStats collect(EntityGraph graph) {
        Map<String, Integer> entityCounts = new HashMap<>();
        int total = 0;
        int resolved = 0;
        for (IfcEntity entity : graph.entities()) {
            entityCounts.merge(entity.type(), 1, Integer::sum);
            for (IfcValue value : entity.parameters()) {
                if (value instanceof IfcRef ref) {
                    total++;
                    if (graph.resolve(ref).isPresent()) {
                        resolved++;
                    }
                }
            }
        }
        return new ValidationStats(
                graph.size(),
                entityCounts.size(),
                entityCounts,
                new ReferenceCounts(total, resolved, total - resolved)
        );
    }
}
