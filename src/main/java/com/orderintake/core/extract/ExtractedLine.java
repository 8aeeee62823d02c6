package com.orderintake.core.extract;

import com.orderintake.core.model.Product;

import java.util.Optional;

/**
 * One product mention pulled from a line of email text.
 *
 * @param product    matched catalog product, {@code null} when the phrase did not match
 * @param rawPhrase  catalog name for matched lines, otherwise the phrase as written
 */
public record ExtractedLine(Product product, int quantity, double confidence, String rawPhrase) {

    public boolean isMatched() {
        return product != null;
    }

    public Optional<Product> productValue() {
        return Optional.ofNullable(product);
    }
}
