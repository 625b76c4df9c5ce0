package com.fooddash.orderservice.service;

import com.fooddash.orderservice.dto.AvailableOrderResponse;
import com.fooddash.orderservice.dto.OrderResponse;
import com.fooddash.orderservice.dto.OrderStatusCountsResponse;
import com.fooddash.orderservice.dto.OrderStatusHistoryResponse;
import com.fooddash.orderservice.dto.ReassignDriverRequest;
import com.fooddash.orderservice.dto.TransitionRequest;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;
import java.util.UUID;

public interface OrderService {

    OrderResponse getOrderById(UUID orderId);

    /**
     * Status history of an order, oldest first.
     */
    List<OrderStatusHistoryResponse> getOrderHistory(UUID orderId);

    /**
     * Orders a driver can claim right now. Requires the DRIVER role.
     */
    List<AvailableOrderResponse> getAvailableOrders(int page, int size, Jwt jwt);

    /**
     * The calling driver's own orders, newest first. Requires the DRIVER role.
     */
    List<OrderResponse> getMyOrders(int page, int size, Jwt jwt);

    /**
     * Non-archived order counts per status. Requires the ADMIN role.
     */
    OrderStatusCountsResponse getStatusCounts(Jwt jwt);

    /**
     * Claims a READY order for the calling driver.
     * Transition: READY -> ASSIGNED. Fails with 409 if another driver won.
     */
    OrderResponse claimOrder(UUID orderId, Jwt jwt);

    /**
     * Moves an order to the requested status on behalf of the caller.
     * Which targets a caller may request depends on their role and their tie to the order.
     */
    OrderResponse changeStatus(UUID orderId, TransitionRequest request, Jwt jwt);

    /**
     * Assigns or replaces the driver of an order. Requires the ADMIN role.
     */
    OrderResponse reassignDriver(UUID orderId, ReassignDriverRequest request, Jwt jwt);
}
