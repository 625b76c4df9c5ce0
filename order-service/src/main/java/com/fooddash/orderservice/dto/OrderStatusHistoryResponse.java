package com.fooddash.orderservice.dto;

import com.fooddash.orderservice.model.ActorType;
import com.fooddash.orderservice.model.OrderStatus;
import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
public class OrderStatusHistoryResponse {
    private UUID id;
    private OrderStatus fromStatus;
    private OrderStatus toStatus;
    private ActorType actorType;
    private UUID actorId;
    private String notes;
    private Instant createdAt;
}
