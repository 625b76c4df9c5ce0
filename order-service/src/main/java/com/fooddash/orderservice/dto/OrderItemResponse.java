package com.fooddash.orderservice.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.UUID;

@Data
public class OrderItemResponse {
    private UUID id;
    private String menuItemName;
    private String menuItemDescription;
    private BigDecimal priceAtTime;
    private Integer quantity;
    private BigDecimal lineTotal;
}
