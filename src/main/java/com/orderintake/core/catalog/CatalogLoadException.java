package com.orderintake.core.catalog;

import java.io.IOException;

/**
 * Raised when the product catalog is missing, unreadable or lacks a required column.
 */
public class CatalogLoadException extends IOException {

    public CatalogLoadException(String message) {
        super(message);
    }

    public CatalogLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
