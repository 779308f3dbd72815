package org.bimrelay.ifc.express;

import java.util.List;

/**
 * DATA 段中的一条实体实例，例如 {@code #34=IFCBUILDING('1jTKhVfdn6vBgO53mfGNFh',#18,...);}。
 * <p>
 * 参数顺序与原文一致（属性位置依赖顺序，不能重排）。
 *
 * @param id         源文件中的实例 id（'#' 后面的数字，不由解析器分配）
 * @param type       实体类型名（大写）
 * @param parameters 参数列表
 * @param raw        原始行文本
 * @param line       在输入文本中的行号（1-based）
 */
public record IfcEntity(
        int id,
        String type,
        List<IfcValue> parameters,
        String raw,
        int line
) {
    public IfcEntity {
        parameters = List.copyOf(parameters);
    }
}
