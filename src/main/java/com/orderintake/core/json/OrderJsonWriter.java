package com.orderintake.core.json;

import com.orderintake.core.model.DeliveryDetails;
import com.orderintake.core.model.Order;
import com.orderintake.core.model.OrderItem;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Locale;

/**
 * Serializes extracted orders for downstream consumers (document rendering, reporting).
 * Absent values are omitted rather than written as {@code null}.
 */
public final class OrderJsonWriter {

    public JSONObject toJson(Order order) {
        JSONObject root = new JSONObject();
        root.put("orderId", order.orderId());
        root.put("customerEmail", order.customerEmail());
        root.put("status", order.status().name().toLowerCase(Locale.ROOT));
        root.put("createdAt", order.createdAt().toString());
        root.put("totalConfidenceScore", order.totalConfidenceScore());

        JSONArray itemsArray = new JSONArray();
        for (OrderItem item : order.items()) {
            itemsArray.put(toJson(item));
        }
        root.put("items", itemsArray);
        root.put("validationIssues", new JSONArray(order.validationIssues()));
        root.put("deliveryDetails", toJson(order.deliveryDetails()));
        order.notes().ifPresent(notes -> root.put("notes", notes));
        return root;
    }

    public String write(Order order) {
        return toJson(order).toString(2);
    }

    public void write(Order order, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(
            target,
            write(order),
            StandardOpenOption.CREATE,
            StandardOpenOption.TRUNCATE_EXISTING,
            StandardOpenOption.WRITE
        );
    }

    private JSONObject toJson(OrderItem item) {
        JSONObject itemObj = new JSONObject();
        itemObj.put("sku", item.sku());
        itemObj.put("quantity", item.quantity());
        itemObj.put("confidenceScore", item.confidenceScore());
        itemObj.put("price", item.price());
        putIfNotEmpty(itemObj, "validationIssues", item.validationIssues());
        putIfNotEmpty(itemObj, "suggestedReplacements", item.suggestedReplacements());
        return itemObj;
    }

    private JSONObject toJson(DeliveryDetails details) {
        JSONObject detailsObj = new JSONObject();
        detailsObj.putOpt("address", details.address());
        detailsObj.putOpt("date", details.date());
        detailsObj.putOpt("instructions", details.instructions());
        return detailsObj;
    }

    private static void putIfNotEmpty(JSONObject target, String key, List<String> values) {
        if (values != null && !values.isEmpty()) {
            target.put(key, new JSONArray(values));
        }
    }
}
