package com.fooddash.orderservice.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

import java.util.UUID;

/**
 * Who caused a status change. Recorded on every history entry.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Actor {

    private static final Actor SYSTEM = new Actor(ActorType.SYSTEM, null);

    ActorType type;
    UUID userId;

    public static Actor system() {
        return SYSTEM;
    }

    public static Actor user(@NonNull UUID userId) {
        return new Actor(ActorType.USER, userId);
    }

    @Override
    public String toString() {
        return type == ActorType.SYSTEM ? "system" : userId.toString();
    }
}
