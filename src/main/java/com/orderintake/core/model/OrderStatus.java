package com.orderintake.core.model;

public enum OrderStatus {
    PENDING,
    APPROVED
}
