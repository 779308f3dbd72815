package org.bimrelay.ifc.dto.express;

/**
 * 实体类型计数项。
 *
 * @param type  实体类型名，如 IFCWALLSTANDARDCASE
 * @param count 实例数
 */
public record IfcEntityTypeCount(
        String type,
        int count
) {
}
