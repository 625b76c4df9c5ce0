package com.fooddash.orderservice.dto;

import com.fooddash.orderservice.model.OrderStatus;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
public class OrderResponse {
    private UUID id;
    private UUID customerId;
    private UUID restaurantId;
    private String restaurantName;
    private UUID driverId;
    private OrderStatus status;
    private List<OrderItemResponse> items;
    private BigDecimal subtotalAmount;
    private BigDecimal taxAmount;
    private BigDecimal deliveryFee;
    private BigDecimal discountAmount;
    private BigDecimal totalAmount;
    private String specialInstructions;
    private Instant placedAt;
    private Instant confirmedAt;
    private Instant readyAt;
    private Instant pickedUpAt;
    private Instant deliveredAt;
    private Instant cancelledAt;
    private String cancellationReason;
    private boolean archived;
    private Instant updatedAt;
    private Long version;
}
