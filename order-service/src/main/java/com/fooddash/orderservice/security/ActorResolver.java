package com.fooddash.orderservice.security;

import com.fooddash.common.exception.AccessDeniedException;
import com.fooddash.orderservice.exception.InvalidStateTransitionException;
import com.fooddash.orderservice.model.Actor;
import com.fooddash.orderservice.model.Order;
import com.fooddash.orderservice.model.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns a validated JWT into an {@link Actor} and decides which callers may drive which
 * status changes on which orders.
 *
 * Roles come from {@code resource_access.<client>.roles}. Vendors are tied to their
 * restaurant through the {@code restaurant_id} claim, so no call to a restaurant
 * service is needed to verify ownership.
 */
@Slf4j
@Component
public class ActorResolver {

    private static final Set<OrderStatus> VENDOR_TARGETS = EnumSet.of(
            OrderStatus.CONFIRMED, OrderStatus.PREPARING, OrderStatus.READY, OrderStatus.CANCELLED);
    private static final Set<OrderStatus> DRIVER_TARGETS = EnumSet.of(
            OrderStatus.IN_TRANSIT, OrderStatus.DELIVERED);

    // Once a driver has the food, only an admin or the vendor may cancel
    private static final Set<OrderStatus> CUSTOMER_CANCELLABLE = EnumSet.of(
            OrderStatus.PENDING, OrderStatus.CONFIRMED, OrderStatus.PREPARING, OrderStatus.READY);

    private final String clientId;

    public ActorResolver(@Value("${fooddash.security.client-id:fooddash-backend}") String clientId) {
        this.clientId = clientId;
    }

    public UUID userId(Jwt jwt) {
        String subject = jwt.getSubject();
        if (subject == null) {
            throw new AccessDeniedException("Access Denied: token has no subject");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            log.warn("JWT subject is not a UUID: sub={}", subject);
            throw new AccessDeniedException("Access Denied: token subject is not a valid user id");
        }
    }

    public Set<Role> roles(Jwt jwt) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        for (String name : extractClientRoles(jwt)) {
            try {
                roles.add(Role.valueOf(name));
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring unknown client role: {}", name);
            }
        }
        return roles;
    }

    /**
     * Returns the caller's id if the token carries {@code role}, otherwise throws
     * {@link AccessDeniedException}.
     */
    public UUID requireRole(Jwt jwt, Role role) {
        UUID userId = userId(jwt);
        if (!roles(jwt).contains(role)) {
            log.warn("Access denied: user {} lacks {} role", userId, role);
            throw new AccessDeniedException("Access Denied: " + role + " role required");
        }
        return userId;
    }

    /**
     * Resolves who may move {@code order} to {@code target}. The caller must hold a role
     * that may reach {@code target} and must be tied to the order through that role.
     *
     * @throws AccessDeniedException if no role of the caller authorizes the change
     * @throws InvalidStateTransitionException if a customer cancels an order already picked up
     */
    public TransitionGrant authorizeTransition(Jwt jwt, Order order, OrderStatus target) {
        UUID userId = userId(jwt);
        Set<Role> roles = roles(jwt);

        if (roles.contains(Role.ADMIN)) {
            return TransitionGrant.of(Actor.user(userId));
        }
        if (roles.contains(Role.VENDOR) && VENDOR_TARGETS.contains(target)
                && order.getRestaurantId().equals(extractRestaurantId(jwt))) {
            return TransitionGrant.of(Actor.user(userId));
        }
        if (roles.contains(Role.DRIVER) && DRIVER_TARGETS.contains(target)
                && userId.equals(order.getDriverId())) {
            return TransitionGrant.asAssignedDriver(userId);
        }
        if (roles.contains(Role.CUSTOMER) && target == OrderStatus.CANCELLED
                && userId.equals(order.getCustomerId())) {
            if (!CUSTOMER_CANCELLABLE.contains(order.getStatus())) {
                throw new InvalidStateTransitionException(order.getStatus(), target,
                        "Order cannot be cancelled in " + order.getStatus() + " status");
            }
            return TransitionGrant.of(Actor.user(userId));
        }

        log.warn("Access denied: user {} with roles {} attempted transition of order {} to {}",
                userId, roles, order.getId(), target);
        throw new AccessDeniedException("Access Denied: you cannot move this order to " + target);
    }

    private List<String> extractClientRoles(Jwt jwt) {
        return Optional.ofNullable(jwt.getClaim("resource_access"))
                .filter(Map.class::isInstance)
                .map(claim -> (Map<?, ?>) claim)
                .map(accessMap -> accessMap.get(clientId))
                .filter(Map.class::isInstance)
                .map(backend -> (Map<?, ?>) backend)
                .map(backendMap -> backendMap.get("roles"))
                .filter(List.class::isInstance)
                .map(roles -> (List<?>) roles)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .toList())
                .orElse(List.of());
    }

    // restaurant_id is mapped from a user attribute by the identity provider
    private UUID extractRestaurantId(Jwt jwt) {
        String restaurantId = jwt.getClaimAsString("restaurant_id");
        if (restaurantId == null || restaurantId.isEmpty()) {
            return null;
        }
        try {
            return UUID.fromString(restaurantId);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed restaurant_id claim: {}", restaurantId);
            return null;
        }
    }
}
