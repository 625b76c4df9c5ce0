package com.fooddash.orderservice.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

// What a driver sees before claiming: no items, no customer details
@Data
public class AvailableOrderResponse {
    private UUID id;
    private UUID restaurantId;
    private String restaurantName;
    private BigDecimal deliveryFee;
    private BigDecimal totalAmount;
    private Instant readyAt;
}
