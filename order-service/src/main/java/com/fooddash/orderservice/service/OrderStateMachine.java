package com.fooddash.orderservice.service;

import com.fooddash.common.exception.ResourceNotFoundException;
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
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Applies single-order status changes.
 *
 * The permitted successors live on {@link OrderStatus}. Each change is one conditional UPDATE
 * guarded on the status that was validated; if another writer moved the order first the update
 * matches nothing and the caller gets a {@link ConflictException}. The history row is written
 * in the same transaction as the order update.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderStateMachine {

    private final OrderRepository orderRepository;
    private final OrderStatusHistoryRepository historyRepository;
    private final DriverAvailabilityService availabilityService;
    private final OrderMapper orderMapper;
    private final Clock clock;

    /**
     * Rejects requests that are invalid whatever the order's state. Runs before any lookup.
     */
    public static void validateRequest(OrderStatus target, String reason) {
        if (target == null) {
            throw new IllegalArgumentException("Target status is required");
        }
        if (target == OrderStatus.ASSIGNED) {
            throw new IllegalArgumentException("Orders are assigned through a driver claim or reassignment");
        }
        if (target == OrderStatus.CANCELLED && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("Cancellation reason is required");
        }
        if (reason != null && reason.length() > Order.MAX_REASON_LENGTH) {
            throw new IllegalArgumentException("Reason must be at most " + Order.MAX_REASON_LENGTH + " characters");
        }
    }

    @Transactional
    public OrderResponse applyTransition(UUID orderId, OrderStatus target, Actor actor, String reason) {
        return applyTransition(orderId, target, actor, reason, null);
    }

    /**
     * Same as {@link #applyTransition(UUID, OrderStatus, Actor, String)}, but when
     * {@code assignedDriverId} is set the IN_TRANSIT and DELIVERED writes also require that
     * driver to still be on the order.
     */
    @Transactional
    public OrderResponse applyTransition(UUID orderId, OrderStatus target, Actor actor, String reason,
                                         UUID assignedDriverId) {
        validateRequest(target, reason);

        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
        OrderStatus current = order.getStatus();

        if (!current.canTransitionTo(target)) {
            log.info("Transition rejected: orderId={}, from={}, to={}, actor={}", orderId, current, target, actor);
            throw new InvalidStateTransitionException(current, target);
        }

        Instant now = clock.instant();
        int rows = switch (target) {
            case CONFIRMED -> orderRepository.confirm(orderId, current, now);
            case READY -> orderRepository.markReady(orderId, current, now);
            case IN_TRANSIT -> assignedDriverId == null
                    ? orderRepository.markPickedUp(orderId, current, now)
                    : orderRepository.markPickedUpByDriver(orderId, current, assignedDriverId, now);
            case DELIVERED -> assignedDriverId == null
                    ? orderRepository.markDelivered(orderId, current, now)
                    : orderRepository.markDeliveredByDriver(orderId, current, assignedDriverId, now);
            case CANCELLED -> orderRepository.cancel(orderId, current, reason, now);
            default -> orderRepository.updateStatus(orderId, current, target, now);
        };

        if (rows == 0) {
            log.info("Concurrent modification: orderId={}, expected={}, target={}", orderId, current, target);
            throw ConflictException.concurrentModification();
        }

        String notes = target == OrderStatus.CANCELLED ? reason : null;
        historyRepository.save(OrderStatusHistory.of(orderId, current, target, actor, notes, now));

        Order updated = reload(orderId);
        if (target.isTerminal() && updated.getDriverId() != null) {
            availabilityService.finishDelivery(updated.getDriverId(), orderId, now);
        }

        log.info("Order status updated: orderId={}, from={}, to={}, actor={}", orderId, current, target, actor);
        return orderMapper.toOrderResponse(updated);
    }

    /**
     * READY to ASSIGNED on behalf of an administrator. Unlike a claim this does not require
     * the driver slot to be empty.
     */
    @Transactional
    public OrderResponse assignReady(UUID orderId, UUID driverId, Actor actor) {
        Instant now = clock.instant();
        int rows = orderRepository.assignReady(orderId, driverId, now);
        if (rows == 0) {
            throw ConflictException.concurrentModification();
        }

        historyRepository.save(OrderStatusHistory.of(orderId, OrderStatus.READY, OrderStatus.ASSIGNED, actor,
                "Driver " + driverId + " assigned by administrator", now));
        availabilityService.startDelivery(driverId, orderId, now);

        log.info("Order assigned by admin: orderId={}, driverId={}, actor={}", orderId, driverId, actor);
        return orderMapper.toOrderResponse(reload(orderId));
    }

    /**
     * Sweep entry point. Cancels the order only if it is still PENDING and was placed before
     * {@code placedBefore}; an order confirmed after candidate selection is left alone.
     *
     * @return true if this call cancelled the order
     */
    @Transactional
    public boolean expireUnconfirmed(UUID orderId, Instant placedBefore, String reason, Instant now) {
        int rows = orderRepository.cancelIfUnconfirmed(orderId, placedBefore, reason, now);
        if (rows == 0) {
            return false;
        }
        historyRepository.save(OrderStatusHistory.of(orderId, OrderStatus.PENDING, OrderStatus.CANCELLED,
                Actor.system(), reason, now));
        return true;
    }

    /**
     * Sets the soft-archive flag on a completed order. Not a status change, so no history row.
     *
     * @return true if this call archived the order
     */
    @Transactional
    public boolean archiveCompleted(UUID orderId, Instant completedBefore, Instant now) {
        return orderRepository.archiveIfCompletedBefore(orderId, completedBefore, now) == 1;
    }

    private Order reload(UUID orderId) {
        return orderRepository.findWithItemsById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
    }
}
