package com.fooddash.orderservice.service;

import com.fooddash.common.exception.ResourceNotFoundException;
import com.fooddash.orderservice.dto.AvailableOrderResponse;
import com.fooddash.orderservice.dto.OrderResponse;
import com.fooddash.orderservice.dto.OrderStatusCountsResponse;
import com.fooddash.orderservice.dto.OrderStatusHistoryResponse;
import com.fooddash.orderservice.dto.ReassignDriverRequest;
import com.fooddash.orderservice.dto.TransitionRequest;
import com.fooddash.orderservice.mapper.OrderMapper;
import com.fooddash.orderservice.model.Actor;
import com.fooddash.orderservice.model.Order;
import com.fooddash.orderservice.model.OrderStatus;
import com.fooddash.orderservice.repository.OrderRepository;
import com.fooddash.orderservice.repository.OrderStatusHistoryRepository;
import com.fooddash.orderservice.repository.StatusCount;
import com.fooddash.orderservice.security.ActorResolver;
import com.fooddash.orderservice.security.Role;
import com.fooddash.orderservice.security.TransitionGrant;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final OrderStateMachine stateMachine;
    private final OrderAssignmentService assignmentService;
    private final ActorResolver actorResolver;
    private final OrderMapper orderMapper;

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderById(UUID orderId) {
        Order order = orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderStatusHistoryResponse> getOrderHistory(UUID orderId) {
        if (!orderRepository.existsById(orderId)) {
            throw new ResourceNotFoundException("Order not found with id: " + orderId);
        }
        return orderMapper.toHistoryResponses(historyRepository.findByOrderIdOrderByCreatedAtAsc(orderId));
    }

    @Override
    public List<AvailableOrderResponse> getAvailableOrders(int page, int size, Jwt jwt) {
        actorResolver.requireRole(jwt, Role.DRIVER);
        return assignmentService.findAvailableOrders(page, size);
    }

    @Override
    public List<OrderResponse> getMyOrders(int page, int size, Jwt jwt) {
        UUID driverId = actorResolver.requireRole(jwt, Role.DRIVER);
        return assignmentService.findDriverOrders(driverId, page, size);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderStatusCountsResponse getStatusCounts(Jwt jwt) {
        actorResolver.requireRole(jwt, Role.ADMIN);

        Map<OrderStatus, Long> counts = new EnumMap<>(OrderStatus.class);
        for (OrderStatus status : OrderStatus.values()) {
            counts.put(status, 0L);
        }
        long total = 0;
        for (StatusCount row : orderRepository.countActiveByStatus()) {
            counts.put(row.getStatus(), row.getOrderCount());
            total += row.getOrderCount();
        }

        OrderStatusCountsResponse response = new OrderStatusCountsResponse();
        response.setCountsByStatus(counts);
        response.setTotal(total);
        return response;
    }

    @Override
    public OrderResponse claimOrder(UUID orderId, Jwt jwt) {
        UUID driverId = actorResolver.requireRole(jwt, Role.DRIVER);
        log.info("Claim requested: orderId={}, driverId={}", orderId, driverId);
        return assignmentService.claim(orderId, driverId);
    }

    // Ownership is checked on a read; a driver's write restates that the driver is still assigned
    @Override
    public OrderResponse changeStatus(UUID orderId, TransitionRequest request, Jwt jwt) {
        OrderStateMachine.validateRequest(request.getStatus(), request.getReason());

        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
        TransitionGrant grant = actorResolver.authorizeTransition(jwt, order, request.getStatus());
        return stateMachine.applyTransition(orderId, request.getStatus(), grant.getActor(), request.getReason(),
                grant.getAssignedDriverId());
    }

    @Override
    public OrderResponse reassignDriver(UUID orderId, ReassignDriverRequest request, Jwt jwt) {
        UUID adminId = actorResolver.requireRole(jwt, Role.ADMIN);
        return assignmentService.reassign(orderId, request.getDriverId(), Actor.user(adminId));
    }
}
