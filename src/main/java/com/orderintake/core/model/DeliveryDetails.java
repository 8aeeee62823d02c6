package com.orderintake.core.model;

import java.util.Optional;

/**
 * Shipping address and required date found in an email. Either may be absent.
 *
 * @param date ISO-8601 calendar date ({@code yyyy-MM-dd})
 */
public record DeliveryDetails(String address, String date, String instructions) {

    public DeliveryDetails(String address, String date) {
        this(address, date, null);
    }

    public static DeliveryDetails empty() {
        return new DeliveryDetails(null, null, null);
    }

    public Optional<String> addressValue() {
        return Optional.ofNullable(address);
    }

    public Optional<String> dateValue() {
        return Optional.ofNullable(date);
    }
}
