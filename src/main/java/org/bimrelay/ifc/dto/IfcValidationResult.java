package org.bimrelay.ifc.dto;

import org.bimrelay.ifc.dto.express.IfcEntityTypeCount;
import org.bimrelay.ifc.dto.express.IfcFindingItem;

import java.util.List;

/**
 * {@code ifc_validate_content}/{@code ifc_validate_file} 的返回结果。
 *
 * @param rootId             根目录标识（内联内容校验时为空）
 * @param path               文件路径（内联内容校验时为空）
 * @param truncated          是否因 maxBytes 只读取了文件前半段
 * @param decodedWith        解码字符集（内联内容校验时为空）
 * @param isValid            是否没有 ERROR 级别发现
 * @param totalEntities      实体数（重复 id 只计一次）
 * @param uniqueTypes        实体类型数
 * @param entityCounts       类型分布（按类型名排序）
 * @param referencesTotal    引用总数
 * @param referencesResolved 可解析的引用数
 * @param referencesBroken   悬空引用数
 * @param errorCount         ERROR 总数
 * @param warningCount       WARNING 总数
 * @param errors             ERROR 列表（受 app.ifc.max-report-findings 限制）
 * @param warnings           WARNING 列表（同上）
 * @param report             文本报告
 * @param notes              工具层提示（截断、编码回退等），与校验结果无关
 */
public record IfcValidationResult(
        String rootId,
        String path,
        boolean truncated,
        String decodedWith,
        boolean isValid,
        int totalEntities,
        int uniqueTypes,
        List<IfcEntityTypeCount> entityCounts,
        int referencesTotal,
        int referencesResolved,
        int referencesBroken,
        int errorCount,
        int warningCount,
        List<IfcFindingItem> errors,
        List<IfcFindingItem> warnings,
        String report,
        List<String> notes
) {
}
