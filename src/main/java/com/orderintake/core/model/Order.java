package com.orderintake.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable purchase order assembled from one email.
 * <p>
 * The aggregate confidence and the validation issue list are always derived from the items:
 * the confidence is the arithmetic mean of the item confidences ({@code 0.0} without items),
 * the issues are the item issues concatenated in item order.
 */
public final class Order {
    private final String orderId;
    private final String customerEmail;
    private final List<OrderItem> items;
    private final double totalConfidenceScore;
    private final List<String> validationIssues;
    private final DeliveryDetails deliveryDetails;
    private final String notes;
    private final OrderStatus status;
    private final Instant createdAt;

    public Order(String orderId,
                 String customerEmail,
                 List<OrderItem> items,
                 DeliveryDetails deliveryDetails,
                 String notes,
                 OrderStatus status,
                 Instant createdAt) {
        this.orderId = requireNonBlank(orderId, "orderId");
        this.customerEmail = requireNonBlank(customerEmail, "customerEmail");
        this.items = items == null ? List.of() : List.copyOf(items);
        this.totalConfidenceScore = meanConfidence(this.items);
        this.validationIssues = collectIssues(this.items);
        this.deliveryDetails = deliveryDetails == null ? DeliveryDetails.empty() : deliveryDetails;
        this.notes = notes;
        this.status = Objects.requireNonNull(status, "status");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String orderId() {
        return orderId;
    }

    public String customerEmail() {
        return customerEmail;
    }

    public List<OrderItem> items() {
        return items;
    }

    public double totalConfidenceScore() {
        return totalConfidenceScore;
    }

    public List<String> validationIssues() {
        return validationIssues;
    }

    public DeliveryDetails deliveryDetails() {
        return deliveryDetails;
    }

    public Optional<String> notes() {
        return Optional.ofNullable(notes);
    }

    public OrderStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * Returns a copy of this order in {@link OrderStatus#APPROVED}.
     *
     * @throws IllegalStateException if the order is not pending
     */
    public Order approve() {
        if (status != OrderStatus.PENDING) {
            throw new IllegalStateException("Order " + orderId + " cannot be approved from status " + status);
        }
        return new Order(orderId, customerEmail, items, deliveryDetails, notes, OrderStatus.APPROVED, createdAt);
    }

    private static double meanConfidence(List<OrderItem> items) {
        if (items.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (OrderItem item : items) {
            total += item.confidenceScore();
        }
        return total / items.size();
    }

    private static List<String> collectIssues(List<OrderItem> items) {
        List<String> issues = new ArrayList<>();
        for (OrderItem item : items) {
            issues.addAll(item.validationIssues());
        }
        return List.copyOf(issues);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Order other)) return false;
        return Double.compare(totalConfidenceScore, other.totalConfidenceScore) == 0
            && orderId.equals(other.orderId)
            && customerEmail.equals(other.customerEmail)
            && items.equals(other.items)
            && deliveryDetails.equals(other.deliveryDetails)
            && Objects.equals(notes, other.notes)
            && status == other.status
            && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId, customerEmail, items, deliveryDetails, notes, status, createdAt);
    }

    @Override
    public String toString() {
        return "Order{" +
            "orderId='" + orderId + '\'' +
            ", customerEmail='" + customerEmail + '\'' +
            ", items=" + items.size() +
            ", totalConfidenceScore=" + totalConfidenceScore +
            ", status=" + status +
            '}';
    }
}
