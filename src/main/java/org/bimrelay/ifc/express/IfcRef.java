package org.bimrelay.ifc.express;

/**
 * 实体引用 {@code #123}。
 * <p>
 * 只保存目标 id，不持有目标实体；解析引用请使用 {@link EntityGraph#resolve(IfcRef)}。
 *
 * @param id 目标实体 id
 */
public record IfcRef(int id) implements IfcValue {
}
