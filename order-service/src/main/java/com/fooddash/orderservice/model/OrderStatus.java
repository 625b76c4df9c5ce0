package com.fooddash.orderservice.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum OrderStatus {
    PENDING,     // Placed by the customer, waiting for the vendor
    CONFIRMED,
    PREPARING,
    READY,       // Waiting for a driver to claim it
    ASSIGNED,
    IN_TRANSIT,
    DELIVERED,
    CANCELLED;

    private static final Map<OrderStatus, Set<OrderStatus>> SUCCESSORS = new EnumMap<>(OrderStatus.class);

    static {
        SUCCESSORS.put(PENDING, EnumSet.of(CONFIRMED, CANCELLED));
        SUCCESSORS.put(CONFIRMED, EnumSet.of(PREPARING, CANCELLED));
        SUCCESSORS.put(PREPARING, EnumSet.of(READY, CANCELLED));
        // READY -> ASSIGNED normally happens through a driver claim
        SUCCESSORS.put(READY, EnumSet.of(ASSIGNED, CANCELLED));
        SUCCESSORS.put(ASSIGNED, EnumSet.of(IN_TRANSIT, CANCELLED));
        SUCCESSORS.put(IN_TRANSIT, EnumSet.of(DELIVERED, CANCELLED));
        SUCCESSORS.put(DELIVERED, EnumSet.noneOf(OrderStatus.class));
        SUCCESSORS.put(CANCELLED, EnumSet.noneOf(OrderStatus.class));
    }

    public Set<OrderStatus> successors() {
        return Collections.unmodifiableSet(SUCCESSORS.get(this));
    }

    public boolean canTransitionTo(OrderStatus target) {
        return target != null && SUCCESSORS.get(this).contains(target);
    }

    public boolean isTerminal() {
        return SUCCESSORS.get(this).isEmpty();
    }
}
