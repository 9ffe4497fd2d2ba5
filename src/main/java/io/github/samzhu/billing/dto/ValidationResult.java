package io.github.samzhu.billing.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * 定價驗證結果。
 *
 * <p>{@code errors} 非空時 {@code valid = false}，此變更不得自動套用；
 * {@code warnings} 只作為審核參考。
 */
public record ValidationResult(
    boolean valid,
    List<String> errors,
    List<String> warnings
) {
    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    public static ValidationResult ok() {
        return new ValidationResult(true, List.of(), List.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /**
     * 合併兩個驗證結果。
     */
    public ValidationResult merge(ValidationResult other) {
        List<String> mergedErrors = new ArrayList<>(errors);
        mergedErrors.addAll(other.errors());
        List<String> mergedWarnings = new ArrayList<>(warnings);
        mergedWarnings.addAll(other.warnings());
        return of(mergedErrors, mergedWarnings);
    }
}
