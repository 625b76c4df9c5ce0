package com.fooddash.orderservice.service;

import com.fooddash.common.exception.AccessDeniedException;
import com.fooddash.orderservice.dto.OrderResponse;
import com.fooddash.orderservice.dto.OrderStatusCountsResponse;
import com.fooddash.orderservice.dto.TransitionRequest;
import com.fooddash.orderservice.exception.InvalidStateTransitionException;
import com.fooddash.orderservice.mapper.OrderMapper;
import com.fooddash.orderservice.model.Actor;
import com.fooddash.orderservice.model.Order;
import com.fooddash.orderservice.model.OrderStatus;
import com.fooddash.orderservice.repository.OrderRepository;
import com.fooddash.orderservice.repository.OrderStatusHistoryRepository;
import com.fooddash.orderservice.repository.StatusCount;
import com.fooddash.orderservice.security.ActorResolver;
import com.fooddash.orderservice.support.TestJwts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderServiceImplTest {

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private OrderStatusHistoryRepository historyRepository;
    @Mock
    private OrderStateMachine stateMachine;
    @Mock
    private OrderAssignmentService assignmentService;
    @Mock
    private OrderMapper orderMapper;
    @Spy
    private ActorResolver actorResolver = new ActorResolver(TestJwts.CLIENT_ID); // real token parsing

    @InjectMocks
    private OrderServiceImpl orderService;

    private UUID orderId;
    private UUID userId;
    private Order order;

    @BeforeEach
    void setUp() {
        orderId = UUID.randomUUID();
        userId = UUID.randomUUID();

        order = new Order();
        order.setId(orderId);
        order.setCustomerId(UUID.randomUUID());
        order.setRestaurantId(UUID.randomUUID());
        order.setStatus(OrderStatus.PENDING);
    }

    @Test
    void driver_transition_is_bound_to_the_calling_driver() {
        order.setStatus(OrderStatus.ASSIGNED);
        order.setDriverId(userId);
        OrderResponse response = new OrderResponse();
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order));
        when(stateMachine.applyTransition(orderId, OrderStatus.IN_TRANSIT, Actor.user(userId), null, userId))
                .thenReturn(response);

        OrderResponse result = orderService.changeStatus(orderId,
                new TransitionRequest(OrderStatus.IN_TRANSIT, null), TestJwts.jwt(userId, "DRIVER"));

        assertThat(result).isSameAs(response);
    }

    @Test
    void admin_transition_is_not_bound_to_a_driver() {
        order.setStatus(OrderStatus.ASSIGNED);
        order.setDriverId(UUID.randomUUID());
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order));

        orderService.changeStatus(orderId, new TransitionRequest(OrderStatus.IN_TRANSIT, null),
                TestJwts.jwt(userId, "ADMIN"));

        verify(stateMachine).applyTransition(eq(orderId), eq(OrderStatus.IN_TRANSIT), eq(Actor.user(userId)),
                isNull(), isNull());
    }

    @Test
    void cancellation_without_reason_fails_before_the_order_is_read() {
        assertThatThrownBy(() -> orderService.changeStatus(orderId,
                new TransitionRequest(OrderStatus.CANCELLED, null), TestJwts.jwt(userId, "CUSTOMER")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cancellation reason is required");

        verifyNoInteractions(orderRepository, stateMachine);
    }

    @Test
    void overlong_reason_fails_before_the_order_is_read() {
        TransitionRequest request = new TransitionRequest(OrderStatus.CANCELLED,
                "x".repeat(Order.MAX_REASON_LENGTH + 1));

        assertThatThrownBy(() -> orderService.changeStatus(orderId, request, TestJwts.jwt(userId, "ADMIN")))
                .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(orderRepository, stateMachine);
    }

    @Test
    void customer_cancel_after_driver_took_order_is_invalid_transition() {
        order.setCustomerId(userId);
        order.setStatus(OrderStatus.ASSIGNED);
        when(orderRepository.findById(orderId)).thenReturn(Optional.of(order));

        assertThatThrownBy(() -> orderService.changeStatus(orderId,
                new TransitionRequest(OrderStatus.CANCELLED, "Too slow"), TestJwts.jwt(userId, "CUSTOMER")))
                .isInstanceOf(InvalidStateTransitionException.class);

        verifyNoInteractions(stateMachine);
    }

    @Test
    void my_orders_are_looked_up_for_the_calling_driver() {
        when(assignmentService.findDriverOrders(userId, 0, 20)).thenReturn(List.of(new OrderResponse()));

        List<OrderResponse> result = orderService.getMyOrders(0, 20, TestJwts.jwt(userId, "DRIVER"));

        assertThat(result).hasSize(1);
    }

    @Test
    void my_orders_require_driver_role() {
        assertThatThrownBy(() -> orderService.getMyOrders(0, 20, TestJwts.jwt(userId, "CUSTOMER")))
                .isInstanceOf(AccessDeniedException.class);

        verifyNoInteractions(assignmentService);
    }

    @Test
    void status_counts_list_every_status() {
        List<StatusCount> rows = List.of(
                statusCount(OrderStatus.PENDING, 3L),
                statusCount(OrderStatus.DELIVERED, 7L));
        when(orderRepository.countActiveByStatus()).thenReturn(rows);

        OrderStatusCountsResponse counts = orderService.getStatusCounts(TestJwts.jwt(userId, "ADMIN"));

        assertThat(counts.getCountsByStatus()).hasSize(OrderStatus.values().length);
        assertThat(counts.getCountsByStatus().get(OrderStatus.PENDING)).isEqualTo(3L);
        assertThat(counts.getCountsByStatus().get(OrderStatus.DELIVERED)).isEqualTo(7L);
        assertThat(counts.getCountsByStatus().get(OrderStatus.READY)).isZero();
        assertThat(counts.getTotal()).isEqualTo(10L);
    }

    @Test
    void status_counts_require_admin_role() {
        assertThatThrownBy(() -> orderService.getStatusCounts(TestJwts.jwt(userId, "VENDOR")))
                .isInstanceOf(AccessDeniedException.class);

        verifyNoInteractions(orderRepository);
    }

    private static StatusCount statusCount(OrderStatus status, Long count) {
        StatusCount row = mock(StatusCount.class);
        when(row.getStatus()).thenReturn(status);
        when(row.getOrderCount()).thenReturn(count);
        return row;
    }
}
