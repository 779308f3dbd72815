package org.bimrelay.ifc.express;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * 把逐行解析出的实体组装成 {@link EntityGraph}。
 * <p>
 * 组装阶段不拒绝任何异常数据：id 冲突时保留第一次插入的实体，冲突本身交给 {@link StructuralValidator} 报告。
 */
public final class EntityGraphBuilder {

    private final LinkedHashMap<Integer, IfcEntity> byId = new LinkedHashMap<>();
    private final List<IfcEntity> declarations = new ArrayList<>();

    public EntityGraphBuilder add(IfcEntity entity) {
        declarations.add(entity);
        byId.putIfAbsent(entity.id(), entity);
        return this;
    }

    public EntityGraph build() {
        return new EntityGraph(new LinkedHashMap<>(byId), declarations);
    }
}
