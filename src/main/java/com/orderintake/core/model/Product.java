package com.orderintake.core.model;

/**
 * Immutable catalog row.
 */
public record Product(String code,
                      String name,
                      int minOrderQuantity,
                      double price,
                      int availableStock,
                      String category) {

    public Product {
        code = requireNonBlank(code, "code");
        name = requireNonBlank(name, "name");
        if (minOrderQuantity < 0) {
            throw new IllegalArgumentException("minOrderQuantity must be >= 0 for " + code);
        }
        if (availableStock < 0) {
            throw new IllegalArgumentException("availableStock must be >= 0 for " + code);
        }
        if (Double.isNaN(price) || price < 0.0) {
            throw new IllegalArgumentException("price must be >= 0 for " + code);
        }
        category = category == null || category.isBlank() ? null : category.trim();
    }

    public Product(String code, String name, int minOrderQuantity, double price, int availableStock) {
        this(code, name, minOrderQuantity, price, availableStock, null);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Product " + field + " must not be blank");
        }
        return value.trim();
    }
}
