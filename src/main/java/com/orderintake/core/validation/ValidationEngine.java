package com.orderintake.core.validation;

import com.orderintake.config.ExtractionSettings;
import com.orderintake.core.catalog.CatalogIndex;
import com.orderintake.core.model.Product;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Checks requested quantities against catalog constraints.
 * <p>
 * The minimum order quantity and the stock check are independent, so a single line can
 * report both. Unknown products only ever report {@link #PRODUCT_NOT_FOUND}.
 */
public class ValidationEngine {

    public static final String PRODUCT_NOT_FOUND = "Product not found in catalog";

    private final CatalogIndex catalog;
    private final ExtractionSettings settings;

    public ValidationEngine(CatalogIndex catalog, ExtractionSettings settings) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public ValidationEngine(CatalogIndex catalog) {
        this(catalog, ExtractionSettings.defaults());
    }

    /**
     * @param product   matched catalog product, or {@code null} when nothing matched
     * @param quantity  requested quantity
     * @param rawPhrase phrase taken from the email, used for suggestions when unmatched
     */
    public ValidationResult validate(Product product, int quantity, String rawPhrase) {
        List<String> issues = new ArrayList<>();
        List<String> suggestions = new ArrayList<>();

        if (product == null) {
            issues.add(PRODUCT_NOT_FOUND);
            if (rawPhrase != null && !rawPhrase.isBlank()) {
                suggestions.addAll(catalog.fuzzyCandidates(rawPhrase, settings.suggestionLimit(), settings.suggestionCutoff()));
            }
            return new ValidationResult(false, issues, suggestions);
        }

        if (quantity < product.minOrderQuantity()) {
            issues.add("Quantity %d is below MOQ of %d for %s"
                .formatted(quantity, product.minOrderQuantity(), product.name()));
            suggestions.add("Increase quantity to " + product.minOrderQuantity());
        }
        if (quantity > product.availableStock()) {
            issues.add("Requested quantity %d exceeds available stock of %d for %s"
                .formatted(quantity, product.availableStock(), product.name()));
            suggestions.add("Reduce quantity to " + product.availableStock());
        }
        return new ValidationResult(issues.isEmpty(), issues, suggestions);
    }

    public ValidationResult validate(Product product, int quantity) {
        return validate(product, quantity, null);
    }
}
