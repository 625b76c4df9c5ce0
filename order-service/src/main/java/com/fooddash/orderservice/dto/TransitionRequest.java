package com.fooddash.orderservice.dto;

import com.fooddash.orderservice.model.Order;
import com.fooddash.orderservice.model.OrderStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransitionRequest {

    @NotNull(message = "Target status is required")
    private OrderStatus status;

    // Required when status is CANCELLED
    @Size(max = Order.MAX_REASON_LENGTH, message = "Reason must be at most 500 characters")
    private String reason;
}
