package com.fooddash.orderservice.dto;

import com.fooddash.orderservice.model.OrderStatus;
import lombok.Data;

import java.util.Map;

// Non-archived orders per status; every status is present, zero when unused
@Data
public class OrderStatusCountsResponse {
    private Map<OrderStatus, Long> countsByStatus;
    private long total;
}
