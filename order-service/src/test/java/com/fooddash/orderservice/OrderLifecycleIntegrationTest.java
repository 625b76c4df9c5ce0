package com.fooddash.orderservice;

import com.fooddash.orderservice.dto.DriverAvailabilityResponse;
import com.fooddash.orderservice.dto.OrderResponse;
import com.fooddash.orderservice.dto.OrderStatusCountsResponse;
import com.fooddash.orderservice.exception.ConflictException;
import com.fooddash.orderservice.exception.InvalidStateTransitionException;
import com.fooddash.orderservice.model.Actor;
import com.fooddash.orderservice.model.Order;
import com.fooddash.orderservice.model.OrderStatus;
import com.fooddash.orderservice.model.OrderStatusHistory;
import com.fooddash.orderservice.repository.OrderRepository;
import com.fooddash.orderservice.repository.OrderStatusHistoryRepository;
import com.fooddash.orderservice.service.DriverAvailabilityService;
import com.fooddash.orderservice.service.OrderAssignmentService;
import com.fooddash.orderservice.service.OrderService;
import com.fooddash.orderservice.service.OrderStateMachine;
import com.fooddash.orderservice.support.TestJwts;
import com.fooddash.orderservice.support.TestOrders;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class OrderLifecycleIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private OrderStateMachine stateMachine;

    @Autowired
    private OrderAssignmentService assignmentService;

    @Autowired
    private DriverAvailabilityService availabilityService;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private OrderStatusHistoryRepository historyRepository;

    @Autowired
    private OrderService orderService;

    @Autowired
    private TestOrders testOrders;

    private Actor vendor;

    @BeforeEach
    void setUp() {
        vendor = Actor.user(UUID.randomUUID());
    }

    @AfterEach
    void clear() {
        testOrders.deleteAll();
    }

    @Test
    void order_travels_from_pending_to_delivered() {
        UUID driverId = UUID.randomUUID();
        availabilityService.heartbeat(driverId);
        UUID orderId = testOrders.create(OrderStatus.PENDING, Instant.now()).getId();

        stateMachine.applyTransition(orderId, OrderStatus.CONFIRMED, vendor, null);
        stateMachine.applyTransition(orderId, OrderStatus.PREPARING, vendor, null);
        stateMachine.applyTransition(orderId, OrderStatus.READY, vendor, null);
        assignmentService.claim(orderId, driverId);

        DriverAvailabilityResponse busy = availabilityService.getAvailability(driverId);
        assertThat(busy.getCurrentOrderId()).isEqualTo(orderId);

        stateMachine.applyTransition(orderId, OrderStatus.IN_TRANSIT, Actor.user(driverId), null);
        OrderResponse delivered = stateMachine.applyTransition(orderId, OrderStatus.DELIVERED,
                Actor.user(driverId), null);

        assertThat(delivered.getStatus()).isEqualTo(OrderStatus.DELIVERED);
        assertThat(delivered.getDriverId()).isEqualTo(driverId);
        assertThat(delivered.getConfirmedAt()).isNotNull();
        assertThat(delivered.getReadyAt()).isNotNull();
        assertThat(delivered.getPickedUpAt()).isNotNull();
        assertThat(delivered.getDeliveredAt()).isNotNull();
        assertThat(delivered.getCancelledAt()).isNull();
        assertThat(delivered.getItems()).hasSize(1);

        List<OrderStatusHistory> history = historyRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
        assertThat(history).extracting(OrderStatusHistory::getToStatus).containsExactly(
                OrderStatus.CONFIRMED, OrderStatus.PREPARING, OrderStatus.READY,
                OrderStatus.ASSIGNED, OrderStatus.IN_TRANSIT, OrderStatus.DELIVERED);
        assertThat(history.get(3).getNotes()).isEqualTo("Driver self-assigned to order");

        assertThat(availabilityService.getAvailability(driverId).getCurrentOrderId()).isNull();
    }

    @Test
    void second_driver_cannot_take_claimed_order() {
        UUID driver7 = UUID.randomUUID();
        UUID driver9 = UUID.randomUUID();
        UUID orderId = testOrders.create(OrderStatus.READY, Instant.now()).getId();

        OrderResponse claimed = assignmentService.claim(orderId, driver7);
        assertThat(claimed.getStatus()).isEqualTo(OrderStatus.ASSIGNED);
        assertThat(claimed.getDriverId()).isEqualTo(driver7);

        assertThatThrownBy(() -> assignmentService.claim(orderId, driver9))
                .isInstanceOf(ConflictException.class);

        Order finalState = orderRepository.findById(orderId).orElseThrow();
        assertThat(finalState.getDriverId()).isEqualTo(driver7);
        assertThat(finalState.getStatus()).isEqualTo(OrderStatus.ASSIGNED);
    }

    @Test
    void illegal_jump_leaves_order_untouched() {
        Order pending = testOrders.create(OrderStatus.PENDING, Instant.now());

        assertThatThrownBy(() -> stateMachine.applyTransition(pending.getId(), OrderStatus.DELIVERED, vendor, null))
                .isInstanceOf(InvalidStateTransitionException.class);

        Order finalState = orderRepository.findById(pending.getId()).orElseThrow();
        assertThat(finalState.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(finalState.getDeliveredAt()).isNull();
        assertThat(finalState.getVersion()).isEqualTo(pending.getVersion());
        assertThat(historyRepository.findByOrderIdOrderByCreatedAtAsc(pending.getId())).isEmpty();
    }

    @Test
    void terminal_order_is_immutable() {
        Order delivered = testOrders.completed(OrderStatus.DELIVERED, Instant.now().minusSeconds(60));

        assertThatThrownBy(() -> assignmentService.claim(delivered.getId(), UUID.randomUUID()))
                .isInstanceOf(ConflictException.class);
        assertThatThrownBy(() -> stateMachine.applyTransition(delivered.getId(), OrderStatus.CANCELLED,
                vendor, "too late"))
                .isInstanceOf(InvalidStateTransitionException.class);
        assertThatThrownBy(() -> assignmentService.reassign(delivered.getId(), UUID.randomUUID(), vendor))
                .isInstanceOf(InvalidStateTransitionException.class);

        Order finalState = orderRepository.findById(delivered.getId()).orElseThrow();
        assertThat(finalState.getStatus()).isEqualTo(OrderStatus.DELIVERED);
        assertThat(finalState.getDriverId()).isEqualTo(delivered.getDriverId());
        assertThat(finalState.getCancelledAt()).isNull();
        assertThat(finalState.getVersion()).isEqualTo(delivered.getVersion());
    }

    @Test
    void admin_swaps_driver_on_order_in_transit() {
        UUID firstDriver = UUID.randomUUID();
        UUID secondDriver = UUID.randomUUID();
        Actor admin = Actor.user(UUID.randomUUID());
        UUID orderId = testOrders.create(OrderStatus.READY, Instant.now()).getId();
        assignmentService.claim(orderId, firstDriver);
        stateMachine.applyTransition(orderId, OrderStatus.IN_TRANSIT, Actor.user(firstDriver), null);

        OrderResponse swapped = assignmentService.reassign(orderId, secondDriver, admin);

        assertThat(swapped.getStatus()).isEqualTo(OrderStatus.IN_TRANSIT);
        assertThat(swapped.getDriverId()).isEqualTo(secondDriver);
        List<OrderStatusHistory> history = historyRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
        OrderStatusHistory last = history.get(history.size() - 1);
        assertThat(last.getFromStatus()).isEqualTo(OrderStatus.IN_TRANSIT);
        assertThat(last.getToStatus()).isEqualTo(OrderStatus.IN_TRANSIT);
        assertThat(last.getActorId()).isEqualTo(admin.getUserId());
    }

    @Test
    void available_list_contains_only_unclaimed_ready_orders() {
        UUID ready = testOrders.create(OrderStatus.READY, Instant.now()).getId();
        UUID claimed = testOrders.create(OrderStatus.READY, Instant.now()).getId();
        testOrders.create(OrderStatus.PREPARING, Instant.now());
        assignmentService.claim(claimed, UUID.randomUUID());

        assertThat(assignmentService.findAvailableOrders(0, 20))
                .extracting(o -> o.getId())
                .containsExactly(ready);
    }

    @Test
    void swapped_out_driver_cannot_pick_up() {
        UUID firstDriver = UUID.randomUUID();
        UUID secondDriver = UUID.randomUUID();
        UUID orderId = testOrders.create(OrderStatus.READY, Instant.now()).getId();
        assignmentService.claim(orderId, firstDriver);
        assignmentService.reassign(orderId, secondDriver, Actor.user(UUID.randomUUID()));

        assertThatThrownBy(() -> stateMachine.applyTransition(orderId, OrderStatus.IN_TRANSIT,
                Actor.user(firstDriver), null, firstDriver))
                .isInstanceOf(ConflictException.class);

        Order finalState = orderRepository.findById(orderId).orElseThrow();
        assertThat(finalState.getStatus()).isEqualTo(OrderStatus.ASSIGNED);
        assertThat(finalState.getDriverId()).isEqualTo(secondDriver);
        assertThat(finalState.getPickedUpAt()).isNull();

        OrderResponse pickedUp = stateMachine.applyTransition(orderId, OrderStatus.IN_TRANSIT,
                Actor.user(secondDriver), null, secondDriver);
        assertThat(pickedUp.getStatus()).isEqualTo(OrderStatus.IN_TRANSIT);
    }

    @Test
    void long_cancellation_reason_is_stored_in_full() {
        String reason = "r".repeat(Order.MAX_REASON_LENGTH);
        UUID orderId = testOrders.create(OrderStatus.PENDING, Instant.now()).getId();

        OrderResponse cancelled = stateMachine.applyTransition(orderId, OrderStatus.CANCELLED, vendor, reason);

        assertThat(cancelled.getCancellationReason()).isEqualTo(reason);
        assertThat(historyRepository.findByOrderIdOrderByCreatedAtAsc(orderId))
                .extracting(OrderStatusHistory::getNotes)
                .containsExactly(reason);
    }

    @Test
    void driver_sees_own_orders_newest_first() {
        UUID driverId = UUID.randomUUID();
        UUID older = testOrders.create(OrderStatus.READY, Instant.now()).getId();
        UUID newer = testOrders.create(OrderStatus.READY, Instant.now()).getId();
        UUID someoneElses = testOrders.create(OrderStatus.READY, Instant.now()).getId();
        assignmentService.claim(older, driverId);
        assignmentService.claim(newer, driverId);
        assignmentService.claim(someoneElses, UUID.randomUUID());

        assertThat(assignmentService.findDriverOrders(driverId, 0, 20))
                .extracting(OrderResponse::getId)
                .containsExactly(newer, older);
    }

    @Test
    void status_counts_cover_non_archived_orders() {
        testOrders.deleteAll();
        testOrders.create(OrderStatus.PENDING, Instant.now());
        testOrders.create(OrderStatus.PENDING, Instant.now());
        testOrders.create(OrderStatus.READY, Instant.now());
        Order archived = testOrders.completed(OrderStatus.DELIVERED, Instant.now().minusSeconds(60));
        stateMachine.archiveCompleted(archived.getId(), Instant.now(), Instant.now());

        OrderStatusCountsResponse counts = orderService.getStatusCounts(
                TestJwts.jwt(UUID.randomUUID(), "ADMIN"));

        assertThat(counts.getCountsByStatus().get(OrderStatus.PENDING)).isEqualTo(2L);
        assertThat(counts.getCountsByStatus().get(OrderStatus.READY)).isEqualTo(1L);
        assertThat(counts.getCountsByStatus().get(OrderStatus.DELIVERED)).isZero();
        assertThat(counts.getTotal()).isEqualTo(3L);
    }
}
