package com.fooddash.orderservice.controller;

import com.fooddash.orderservice.dto.AvailableOrderResponse;
import com.fooddash.orderservice.dto.OrderResponse;
import com.fooddash.orderservice.dto.OrderStatusCountsResponse;
import com.fooddash.orderservice.dto.OrderStatusHistoryResponse;
import com.fooddash.orderservice.dto.ReassignDriverRequest;
import com.fooddash.orderservice.dto.TransitionRequest;
import com.fooddash.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @GetMapping("/available")
    public ResponseEntity<List<AvailableOrderResponse>> getAvailableOrders(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getAvailableOrders(page, size, jwt));
    }

    @GetMapping("/mine")
    public ResponseEntity<List<OrderResponse>> getMyOrders(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getMyOrders(page, size, jwt));
    }

    @GetMapping("/stats")
    public ResponseEntity<OrderStatusCountsResponse> getStatusCounts(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.getStatusCounts(jwt));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(@PathVariable UUID orderId) {
        return ResponseEntity.ok(orderService.getOrderById(orderId));
    }

    @GetMapping("/{orderId}/history")
    public ResponseEntity<List<OrderStatusHistoryResponse>> getOrderHistory(@PathVariable UUID orderId) {
        return ResponseEntity.ok(orderService.getOrderHistory(orderId));
    }

    @PostMapping("/{orderId}/claim")
    public ResponseEntity<OrderResponse> claimOrder(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.claimOrder(orderId, jwt);
        return ResponseEntity.ok(response);
    }

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> changeStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody TransitionRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.changeStatus(orderId, request, jwt);
        return ResponseEntity.ok(response);
    }

    @PutMapping("/{orderId}/driver")
    public ResponseEntity<OrderResponse> reassignDriver(
            @PathVariable UUID orderId,
            @Valid @RequestBody ReassignDriverRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.reassignDriver(orderId, request, jwt);
        return ResponseEntity.ok(response);
    }
}
