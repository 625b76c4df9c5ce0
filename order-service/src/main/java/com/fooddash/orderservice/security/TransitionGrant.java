package com.fooddash.orderservice.security;

import com.fooddash.orderservice.model.Actor;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of an authorized status change request.
 * {@code assignedDriverId} is set when the caller acts as the order's driver; the write must
 * then still find that driver on the order.
 */
@Value
public class TransitionGrant {

    Actor actor;
    UUID assignedDriverId;

    public static TransitionGrant of(Actor actor) {
        return new TransitionGrant(actor, null);
    }

    public static TransitionGrant asAssignedDriver(UUID driverId) {
        return new TransitionGrant(Actor.user(driverId), driverId);
    }
}
