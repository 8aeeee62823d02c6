package com.orderintake.core.validation;

import java.util.List;

/**
 * Outcome of checking one extracted line against the catalog.
 */
public record ValidationResult(boolean valid, List<String> issues, List<String> suggestions) {

    public ValidationResult {
        issues = issues == null ? List.of() : List.copyOf(issues);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
