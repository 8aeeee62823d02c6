package com.orderintake.core.json;

import com.orderintake.core.model.DeliveryDetails;
import com.orderintake.core.model.Order;
import com.orderintake.core.model.OrderItem;
import com.orderintake.core.model.OrderStatus;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrderJsonWriterTest {

    @TempDir
    Path tempDir;

    private final OrderJsonWriter writer = new OrderJsonWriter();

    @Test
    void writesOrderFields() {
        Order order = new Order("ORD-20261016101500", "jane@example.com", List.of(
            new OrderItem("ABC-123", 5, 1.0, 9.99, List.of(), List.of()),
            new OrderItem("SW-100", 10, 1.0, 4.5, List.of("Quantity 10 is below MOQ of 20 for SuperWidget"), List.of("Increase quantity to 20"))
        ), new DeliveryDetails("123 Main Street, Springfield", "2026-11-20"), "Please call before delivery",
            OrderStatus.PENDING, Instant.parse("2026-10-17T09:00:00Z"));

        JSONObject json = writer.toJson(order);

        assertEquals("ORD-20261016101500", json.getString("orderId"));
        assertEquals("pending", json.getString("status"));
        assertEquals("2026-10-17T09:00:00Z", json.getString("createdAt"));
        assertEquals(1.0, json.getDouble("totalConfidenceScore"), 1e-9);
        assertEquals("Please call before delivery", json.getString("notes"));

        JSONArray items = json.getJSONArray("items");
        assertEquals(2, items.length());
        assertFalse(items.getJSONObject(0).has("validationIssues"));
        assertEquals("Increase quantity to 20", items.getJSONObject(1).getJSONArray("suggestedReplacements").getString(0));
        assertEquals(1, json.getJSONArray("validationIssues").length());

        JSONObject delivery = json.getJSONObject("deliveryDetails");
        assertEquals("123 Main Street, Springfield", delivery.getString("address"));
        assertEquals("2026-11-20", delivery.getString("date"));
        assertFalse(delivery.has("instructions"));
    }

    @Test
    void omitsAbsentValues() {
        Order order = new Order("ORD-TEMP", "unknown@email.com", List.of(), DeliveryDetails.empty(), null,
            OrderStatus.PENDING, Instant.parse("2026-10-17T09:00:00Z"));

        JSONObject json = writer.toJson(order);

        assertFalse(json.has("notes"));
        assertTrue(json.getJSONObject("deliveryDetails").isEmpty());
        assertTrue(json.getJSONArray("items").isEmpty());
        assertEquals(0.0, json.getDouble("totalConfidenceScore"), 1e-9);
    }

    @Test
    void writesFileCreatingParentFolders() throws IOException {
        Order order = new Order("ORD-TEMP", "unknown@email.com", List.of(), null, null,
            OrderStatus.APPROVED, Instant.parse("2026-10-17T09:00:00Z"));
        Path target = tempDir.resolve("out/nested/order.json");

        writer.write(order, target);

        assertTrue(Files.exists(target), "JSON file should be written");
        JSONObject json = new JSONObject(Files.readString(target));
        assertEquals("approved", json.getString("status"));
    }
}
