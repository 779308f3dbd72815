package org.bimrelay.ifc.express;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * IFC 内容校验入口。
 * <p>
 * 流程：{@link IfcExpressParser} 得到实体图 → {@link StructuralValidator} 与 {@link StatisticsCollector}
 * 读取同一张只读图 → 按严重程度拆分为 errors/warnings。
 * <p>
 * {@link #validate(String)} 从不抛异常：缺少 DATA 段或任何意外异常都会转换为
 * “一条 SYNTAX 错误 + 全零统计”的结果。实例无可变状态，可以并发调用。
 */
public class IfcValidator {

    private static final Logger log = LoggerFactory.getLogger(IfcValidator.class);

    private final StructuralValidator structuralValidator;

    public IfcValidator() {
        this(new StructuralValidator());
    }

    public IfcValidator(StructuralValidator structuralValidator) {
        this.structuralValidator = structuralValidator;
    }

    public ValidationResult validate(String content) {
        try {
            IfcExpressParser.ParsedData parsed = IfcExpressParser.parse(content);
            EntityGraph graph = parsed.graph();

            List<Finding> findings = new ArrayList<>(parsed.warnings());
            findings.addAll(structuralValidator.validate(graph));
            ValidationStats stats = StatisticsCollector.collect(graph);

            List<Finding> errors = new ArrayList<>();
            List<Finding> warnings = new ArrayList<>();
            for (Finding finding : findings) {
                if (finding.isError()) {
                    errors.add(finding);
                } else {
                    warnings.add(finding);
                }
            }
            log.debug("校验完成：entities={}, errors={}, warnings={}", stats.totalEntities(), errors.size(), warnings.size());
            return new ValidationResult(errors.isEmpty(), errors, warnings, stats);
        } catch (IfcSyntaxException e) {
            return ValidationResult.syntaxFailure(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("IFC 内容解析出现意外异常", e);
            return ValidationResult.syntaxFailure("Failed to parse IFC content: " + e.getMessage());
        }
    }
}
