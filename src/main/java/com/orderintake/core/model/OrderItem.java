package com.orderintake.core.model;

import java.util.List;

/**
 * One product line of an extracted order.
 * <p>
 * {@code sku} holds the catalog code when the line was matched, otherwise the phrase as it
 * appeared in the email. Issues and suggestions are empty for valid lines.
 */
public record OrderItem(String sku,
                        int quantity,
                        double confidenceScore,
                        double price,
                        List<String> validationIssues,
                        List<String> suggestedReplacements) {

    public OrderItem {
        if (sku == null) {
            throw new IllegalArgumentException("sku must not be null");
        }
        if (Double.isNaN(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 1.0) {
            throw new IllegalArgumentException("confidenceScore must be within [0, 1] but was " + confidenceScore);
        }
        validationIssues = validationIssues == null ? List.of() : List.copyOf(validationIssues);
        suggestedReplacements = suggestedReplacements == null ? List.of() : List.copyOf(suggestedReplacements);
    }

    public boolean hasIssues() {
        return !validationIssues.isEmpty();
    }
}
