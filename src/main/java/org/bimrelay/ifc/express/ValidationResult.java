package org.bimrelay.ifc.express;

import java.util.List;

/**
 * 一次校验的结果。{@code isValid} 当且仅当没有 ERROR 级别的发现。
 *
 * @param isValid  是否有效
 * @param errors   ERROR 级别发现
 * @param warnings WARNING 级别发现
 * @param stats    统计
 */
public record ValidationResult(
        boolean isValid,
        List<Finding> errors,
        List<Finding> warnings,
        ValidationStats stats
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    static ValidationResult syntaxFailure(String message) {
        Finding error = new Finding(FindingKind.SYNTAX, Severity.ERROR, null, null, message);
        return new ValidationResult(false, List.of(error), List.of(), ValidationStats.empty());
    }
}
