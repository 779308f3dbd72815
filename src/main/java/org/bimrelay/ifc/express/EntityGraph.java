package org.bimrelay.ifc.express;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 解析完成后的实体图（只读）。
 * <p>
 * 同时保留两个视图：
 * <ul>
 *   <li>{@link #get(int)}/{@link #entities()}：按 id 寻址，重复 id 只保留第一次出现的实体</li>
 *   <li>{@link #declarations()}：按源文件顺序的全部实体声明（包括重复 id），供结构校验使用</li>
 * </ul>
 */
public final class EntityGraph {

    private final Map<Integer, IfcEntity> byId;
    private final List<IfcEntity> declarations;

    EntityGraph(LinkedHashMap<Integer, IfcEntity> byId, List<IfcEntity> declarations) {
        this.byId = Collections.unmodifiableMap(byId);
        this.declarations = List.copyOf(declarations);
    }

    public IfcEntity get(int id) {
        return byId.get(id);
    }

    public boolean contains(int id) {
        return byId.containsKey(id);
    }

    public Optional<IfcEntity> resolve(IfcRef ref) {
        return Optional.ofNullable(byId.get(ref.id()));
    }

    public Collection<IfcEntity> entities() {
        return byId.values();
    }

    public List<IfcEntity> declarations() {
        return declarations;
    }

    public int size() {
        return byId.size();
    }
}
