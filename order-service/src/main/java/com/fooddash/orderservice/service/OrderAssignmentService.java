package com.fooddash.orderservice.service;

import com.fooddash.common.exception.ResourceNotFoundException;
import com.fooddash.orderservice.dto.AvailableOrderResponse;
import com.fooddash.orderservice.dto.OrderResponse;
import com.fooddash.orderservice.exception.ConflictException;
import com.fooddash.orderservice.exception.InvalidStateTransitionException;
import com.fooddash.orderservice.mapper.OrderMapper;
import com.fooddash.orderservice.model.Actor;
import com.fooddash.orderservice.model.Order;
import com.fooddash.orderservice.model.OrderStatus;
import com.fooddash.orderservice.model.OrderStatusHistory;
import com.fooddash.orderservice.repository.OrderRepository;
import com.fooddash.orderservice.repository.OrderStatusHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Decides which driver delivers an order.
 *
 * A claim is a single conditional UPDATE on the order row: the database serializes
 * competing claims and exactly one of them matches. There is no lock and no retry;
 * losers get a {@link ConflictException} and re-poll the available list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderAssignmentService {

    static final String SELF_ASSIGNED_NOTE = "Driver self-assigned to order";
    static final int MAX_PAGE_SIZE = 100;

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final OrderStateMachine stateMachine;
    private final DriverAvailabilityService availabilityService;
    private final OrderMapper orderMapper;
    private final Clock clock;

    @Transactional
    public OrderResponse claim(UUID orderId, UUID driverId) {
        Instant now = clock.instant();
        int rows = orderRepository.claim(orderId, driverId, now);

        if (rows == 0) {
            if (!orderRepository.existsById(orderId)) {
                throw new ResourceNotFoundException("Order not found with id: " + orderId);
            }
            log.info("Claim lost: orderId={}, driverId={}", orderId, driverId);
            throw ConflictException.alreadyClaimed();
        }

        historyRepository.save(OrderStatusHistory.of(orderId, OrderStatus.READY, OrderStatus.ASSIGNED,
                Actor.user(driverId), SELF_ASSIGNED_NOTE, now));
        availabilityService.startDelivery(driverId, orderId, now);

        Order order = orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
        log.info("Order claimed: orderId={}, driverId={}", orderId, driverId);
        return orderMapper.toOrderResponse(order);
    }

    /**
     * Administrative driver assignment. A READY order is assigned through the state machine;
     * an ASSIGNED or IN_TRANSIT order gets its driver swapped with the status left as is.
     */
    @Transactional
    public OrderResponse reassign(UUID orderId, UUID driverId, Actor actor) {
        if (driverId == null) {
            throw new IllegalArgumentException("Driver id is required");
        }

        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
        OrderStatus current = order.getStatus();
        UUID previousDriverId = order.getDriverId();

        if (current == OrderStatus.READY) {
            return stateMachine.assignReady(orderId, driverId, actor);
        }
        if (current != OrderStatus.ASSIGNED && current != OrderStatus.IN_TRANSIT) {
            throw new InvalidStateTransitionException(current, OrderStatus.ASSIGNED,
                    "Cannot assign a driver to an order in " + current + " status");
        }

        Instant now = clock.instant();
        int rows = orderRepository.reassignDriver(orderId, current, driverId, now);
        if (rows == 0) {
            throw ConflictException.concurrentModification();
        }

        historyRepository.save(OrderStatusHistory.of(orderId, current, current, actor,
                "Driver reassigned from " + previousDriverId + " to " + driverId, now));
        if (previousDriverId != null) {
            availabilityService.finishDelivery(previousDriverId, orderId, now);
        }
        availabilityService.startDelivery(driverId, orderId, now);

        Order updated = orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
        log.info("Driver reassigned: orderId={}, from={}, to={}, actor={}", orderId, previousDriverId, driverId, actor);
        return orderMapper.toOrderResponse(updated);
    }

    // READY, unassigned, non-archived orders, oldest ready first
    @Transactional(readOnly = true)
    public List<AvailableOrderResponse> findAvailableOrders(int page, int size) {
        return orderMapper.toAvailableOrderResponses(orderRepository.findClaimable(pageRequest(page, size)));
    }

    // Orders the driver holds or has delivered, newest first; archived orders are left out
    @Transactional(readOnly = true)
    public List<OrderResponse> findDriverOrders(UUID driverId, int page, int size) {
        return orderMapper.toOrderResponses(
                orderRepository.findByDriverIdAndArchivedFalseOrderByCreatedAtDesc(driverId, pageRequest(page, size)));
    }

    private static PageRequest pageRequest(int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("Page index must not be negative");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("Page size must be between 1 and " + MAX_PAGE_SIZE);
        }
        return PageRequest.of(page, size);
    }
}
