package com.fooddash.orderservice.exception;

import com.fooddash.orderservice.model.OrderStatus;

/**
 * Exception thrown when the requested target is not a permitted successor of the current status.
 * For example: trying to deliver an order that is still PENDING
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidStateTransitionException extends RuntimeException {

    private final OrderStatus from;
    private final OrderStatus to;

    public InvalidStateTransitionException(OrderStatus from, OrderStatus to) {
        super("Cannot change order status from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public InvalidStateTransitionException(OrderStatus from, OrderStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public OrderStatus getFrom() {
        return from;
    }

    public OrderStatus getTo() {
        return to;
    }
}
