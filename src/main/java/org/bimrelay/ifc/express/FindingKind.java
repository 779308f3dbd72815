package org.bimrelay.ifc.express;

/**
 * 校验发现的问题类别。
 */
public enum FindingKind {
    /**
     * 无法切分/解析：缺少 DATA 段、参数未闭合、内部异常等。
     */
    SYNTAX,
    /**
     * id 空间问题：重复 id、GlobalId 格式错误。
     */
    SCHEMA,
    /**
     * 图一致性问题：引用指向不存在的实体。
     */
    SEMANTIC
}
