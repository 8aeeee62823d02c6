package com.orderintake.core.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderTest {

    private static final Instant CREATED = Instant.parse("2026-10-17T09:00:00Z");

    @Test
    void derivesConfidenceAndIssuesFromItems() {
        Order order = new Order("ORD-1", "jane@example.com", List.of(
            new OrderItem("ABC-123", 5, 1.0, 9.99, List.of(), List.of()),
            new OrderItem("SW-100", 10, 0.8, 4.5, List.of("Quantity 10 is below MOQ of 20 for SuperWidget"), List.of("Increase quantity to 20"))
        ), DeliveryDetails.empty(), null, OrderStatus.PENDING, CREATED);

        assertEquals(0.9, order.totalConfidenceScore(), 1e-9);
        assertEquals(List.of("Quantity 10 is below MOQ of 20 for SuperWidget"), order.validationIssues());
        assertTrue(order.notes().isEmpty());
    }

    @Test
    void emptyOrderHasZeroConfidence() {
        Order order = new Order("ORD-TEMP", "unknown@email.com", List.of(), null, null, OrderStatus.PENDING, CREATED);

        assertTrue(order.isEmpty());
        assertEquals(0.0, order.totalConfidenceScore(), 1e-9);
        assertTrue(order.validationIssues().isEmpty());
        assertEquals(DeliveryDetails.empty(), order.deliveryDetails());
    }

    @Test
    void approveMovesPendingToApproved() {
        Order pending = new Order("ORD-1", "jane@example.com", List.of(), null, "call first", OrderStatus.PENDING, CREATED);

        Order approved = pending.approve();

        assertEquals(OrderStatus.APPROVED, approved.status());
        assertEquals(OrderStatus.PENDING, pending.status());
        assertEquals("call first", approved.notes().orElseThrow());
        assertNotEquals(pending, approved);
        assertThrows(IllegalStateException.class, approved::approve);
    }

    @Test
    void rejectsBlankIdentity() {
        assertThrows(IllegalArgumentException.class,
            () -> new Order(" ", "jane@example.com", List.of(), null, null, OrderStatus.PENDING, CREATED));
        assertThrows(IllegalArgumentException.class,
            () -> new OrderItem("ABC-123", 1, 1.5, 9.99, null, null));
    }
}
