package com.fooddash.orderservice.repository;

import com.fooddash.orderservice.model.Order;
import com.fooddash.orderservice.model.OrderStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Order store.
 *
 * Every write below is a single conditional UPDATE: the WHERE clause restates the
 * precondition and the returned row count (0 or 1) is the only success signal.
 * Callers never read a row, check it in Java and then write it unconditionally.
 *
 * All @Modifying queries must run inside a transaction.
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    @Query("SELECT o FROM Order o LEFT JOIN FETCH o.items WHERE o.id = :id")
    Optional<Order> findWithItemsById(@Param("id") UUID id);

    // Orders a driver may claim, oldest ready first
    @Query("SELECT o FROM Order o WHERE o.status = com.fooddash.orderservice.model.OrderStatus.READY " +
            "AND o.driverId IS NULL AND o.archived = false ORDER BY o.readyAt ASC, o.createdAt ASC")
    List<Order> findClaimable(Pageable pageable);

    // A driver's own orders, newest first
    List<Order> findByDriverIdAndArchivedFalseOrderByCreatedAtDesc(UUID driverId, Pageable pageable);

    @Query("SELECT o.status AS status, COUNT(o) AS orderCount FROM Order o " +
            "WHERE o.archived = false GROUP BY o.status")
    List<StatusCount> countActiveByStatus();

    // ---- driver claim ----

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.driverId = :driverId, " +
            "o.status = com.fooddash.orderservice.model.OrderStatus.ASSIGNED, " +
            "o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = com.fooddash.orderservice.model.OrderStatus.READY " +
            "AND o.driverId IS NULL AND o.archived = false")
    int claim(@Param("id") UUID id, @Param("driverId") UUID driverId, @Param("now") Instant now);

    // ---- administrative assignment ----

    // READY -> ASSIGNED by an admin; no "driver unset" precondition
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.driverId = :driverId, " +
            "o.status = com.fooddash.orderservice.model.OrderStatus.ASSIGNED, " +
            "o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = com.fooddash.orderservice.model.OrderStatus.READY " +
            "AND o.archived = false")
    int assignReady(@Param("id") UUID id, @Param("driverId") UUID driverId, @Param("now") Instant now);

    // Driver swap on an order that is already assigned and not yet terminal
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.driverId = :driverId, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :expected AND o.archived = false " +
            "AND o.status IN (com.fooddash.orderservice.model.OrderStatus.ASSIGNED, " +
            "com.fooddash.orderservice.model.OrderStatus.IN_TRANSIT)")
    int reassignDriver(@Param("id") UUID id, @Param("expected") OrderStatus expected,
                       @Param("driverId") UUID driverId, @Param("now") Instant now);

    // ---- state machine transitions, guarded on the status that was validated ----

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = :target, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :expected AND o.archived = false")
    int updateStatus(@Param("id") UUID id, @Param("expected") OrderStatus expected,
                     @Param("target") OrderStatus target, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = com.fooddash.orderservice.model.OrderStatus.CONFIRMED, " +
            "o.confirmedAt = :now, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :expected AND o.archived = false")
    int confirm(@Param("id") UUID id, @Param("expected") OrderStatus expected, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = com.fooddash.orderservice.model.OrderStatus.READY, " +
            "o.readyAt = :now, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :expected AND o.archived = false")
    int markReady(@Param("id") UUID id, @Param("expected") OrderStatus expected, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = com.fooddash.orderservice.model.OrderStatus.IN_TRANSIT, " +
            "o.pickedUpAt = :now, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :expected AND o.archived = false")
    int markPickedUp(@Param("id") UUID id, @Param("expected") OrderStatus expected, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = com.fooddash.orderservice.model.OrderStatus.DELIVERED, " +
            "o.deliveredAt = :now, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :expected AND o.archived = false")
    int markDelivered(@Param("id") UUID id, @Param("expected") OrderStatus expected, @Param("now") Instant now);

    // Driver-initiated variants: the write also requires the caller to still be the order's driver,
    // so a driver swapped out by an admin cannot advance the order any more

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = com.fooddash.orderservice.model.OrderStatus.IN_TRANSIT, " +
            "o.pickedUpAt = :now, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :expected AND o.driverId = :driverId AND o.archived = false")
    int markPickedUpByDriver(@Param("id") UUID id, @Param("expected") OrderStatus expected,
                             @Param("driverId") UUID driverId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = com.fooddash.orderservice.model.OrderStatus.DELIVERED, " +
            "o.deliveredAt = :now, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :expected AND o.driverId = :driverId AND o.archived = false")
    int markDeliveredByDriver(@Param("id") UUID id, @Param("expected") OrderStatus expected,
                              @Param("driverId") UUID driverId, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = com.fooddash.orderservice.model.OrderStatus.CANCELLED, " +
            "o.cancelledAt = :now, o.cancellationReason = :reason, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = :expected AND o.archived = false")
    int cancel(@Param("id") UUID id, @Param("expected") OrderStatus expected,
               @Param("reason") String reason, @Param("now") Instant now);

    // ---- maintenance sweeps: candidate selection + per-row conditional write ----

    @Query("SELECT o.id FROM Order o WHERE o.status = com.fooddash.orderservice.model.OrderStatus.PENDING " +
            "AND o.placedAt < :placedBefore AND o.archived = false ORDER BY o.placedAt ASC")
    List<UUID> findUnconfirmedPlacedBefore(@Param("placedBefore") Instant placedBefore, Pageable pageable);

    // Restates the selection predicate so an order confirmed meanwhile is skipped
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.status = com.fooddash.orderservice.model.OrderStatus.CANCELLED, " +
            "o.cancelledAt = :now, o.cancellationReason = :reason, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.status = com.fooddash.orderservice.model.OrderStatus.PENDING " +
            "AND o.placedAt < :placedBefore AND o.archived = false")
    int cancelIfUnconfirmed(@Param("id") UUID id, @Param("placedBefore") Instant placedBefore,
                            @Param("reason") String reason, @Param("now") Instant now);

    @Query("SELECT o.id FROM Order o WHERE o.archived = false AND (" +
            "(o.status = com.fooddash.orderservice.model.OrderStatus.DELIVERED AND o.deliveredAt < :completedBefore) OR " +
            "(o.status = com.fooddash.orderservice.model.OrderStatus.CANCELLED AND o.cancelledAt < :completedBefore))")
    List<UUID> findArchivableCompletedBefore(@Param("completedBefore") Instant completedBefore, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Order o SET o.archived = true, o.updatedAt = :now, o.version = o.version + 1 " +
            "WHERE o.id = :id AND o.archived = false AND (" +
            "(o.status = com.fooddash.orderservice.model.OrderStatus.DELIVERED AND o.deliveredAt < :completedBefore) OR " +
            "(o.status = com.fooddash.orderservice.model.OrderStatus.CANCELLED AND o.cancelledAt < :completedBefore))")
    int archiveIfCompletedBefore(@Param("id") UUID id, @Param("completedBefore") Instant completedBefore,
                                 @Param("now") Instant now);
}
