package com.orderintake.core.validation;

import com.orderintake.core.catalog.CatalogIndex;
import com.orderintake.core.model.Product;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationEngineTest {

    private final Product superWidget = new Product("SW-100", "SuperWidget", 20, 4.5, 5000);
    private final Product deskLamp = new Product("DSK-200", "Desk Lamp", 5, 35.0, 0);
    private final Product widget = new Product("ABC-123", "Widget Basic", 1, 9.99, 100);

    private final ValidationEngine engine = new ValidationEngine(new CatalogIndex(List.of(widget, superWidget, deskLamp)));

    @Test
    void validQuantityHasNoIssues() {
        ValidationResult result = engine.validate(widget, 5);

        assertTrue(result.valid());
        assertTrue(result.issues().isEmpty());
        assertTrue(result.suggestions().isEmpty());
    }

    @Test
    void belowMinimumOrderQuantity() {
        ValidationResult result = engine.validate(superWidget, 10);

        assertFalse(result.valid());
        assertEquals(List.of("Quantity 10 is below MOQ of 20 for SuperWidget"), result.issues());
        assertEquals(List.of("Increase quantity to 20"), result.suggestions());
    }

    @Test
    void exactlyMinimumAndExactlyStockAreAccepted() {
        assertTrue(engine.validate(superWidget, 20).valid());
        assertTrue(engine.validate(widget, 100).valid());
    }

    @Test
    void aboveAvailableStock() {
        ValidationResult result = engine.validate(widget, 101);

        assertEquals(List.of("Requested quantity 101 exceeds available stock of 100 for Widget Basic"), result.issues());
        assertEquals(List.of("Reduce quantity to 100"), result.suggestions());
    }

    @Test
    void reportsBothChecksInOrder() {
        ValidationResult result = engine.validate(deskLamp, 3);

        assertEquals(List.of(
            "Quantity 3 is below MOQ of 5 for Desk Lamp",
            "Requested quantity 3 exceeds available stock of 0 for Desk Lamp"
        ), result.issues());
        assertEquals(List.of("Increase quantity to 5", "Reduce quantity to 0"), result.suggestions());
    }

    @Test
    void unknownProductOnlyReportsNotFound() {
        ValidationResult result = engine.validate(null, 5, "SuperWidgt");

        assertFalse(result.valid());
        assertEquals(List.of(ValidationEngine.PRODUCT_NOT_FOUND), result.issues());
        assertEquals(List.of("SuperWidget"), result.suggestions());
    }

    @Test
    void unknownProductWithoutPhraseHasNoSuggestions() {
        ValidationResult result = engine.validate(null, 5);

        assertEquals(List.of(ValidationEngine.PRODUCT_NOT_FOUND), result.issues());
        assertTrue(result.suggestions().isEmpty());
    }
}
