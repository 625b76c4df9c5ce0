package com.fooddash.orderservice.repository;

import com.fooddash.orderservice.model.DriverAvailability;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface DriverAvailabilityRepository extends JpaRepository<DriverAvailability, UUID> {

    /**
     * Creates the row on the first heartbeat, otherwise marks the driver available
     * with the new heartbeat time. Single statement, last write wins.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = "INSERT INTO driver_availability " +
            "(driver_id, available, last_heartbeat_at, created_at, updated_at) " +
            "VALUES (:driverId, true, :heartbeatAt, :now, :now) " +
            "ON CONFLICT (driver_id) DO UPDATE SET available = true, " +
            "last_heartbeat_at = EXCLUDED.last_heartbeat_at, updated_at = EXCLUDED.updated_at",
            nativeQuery = true)
    int upsertHeartbeat(@Param("driverId") UUID driverId, @Param("heartbeatAt") Instant heartbeatAt,
                        @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DriverAvailability d SET d.available = false, d.updatedAt = :now " +
            "WHERE d.driverId = :driverId")
    int markUnavailable(@Param("driverId") UUID driverId, @Param("now") Instant now);

    @Query("SELECT d.driverId FROM DriverAvailability d WHERE d.available = true " +
            "AND d.lastHeartbeatAt < :heartbeatBefore ORDER BY d.lastHeartbeatAt ASC")
    List<UUID> findStaleAvailable(@Param("heartbeatBefore") Instant heartbeatBefore, Pageable pageable);

    // Restates the staleness predicate so a heartbeat that lands meanwhile wins
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DriverAvailability d SET d.available = false, d.updatedAt = :now " +
            "WHERE d.driverId = :driverId AND d.available = true AND d.lastHeartbeatAt < :heartbeatBefore")
    int markUnavailableIfStale(@Param("driverId") UUID driverId, @Param("heartbeatBefore") Instant heartbeatBefore,
                               @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DriverAvailability d SET d.currentOrderId = :orderId, d.updatedAt = :now " +
            "WHERE d.driverId = :driverId")
    int startDelivery(@Param("driverId") UUID driverId, @Param("orderId") UUID orderId, @Param("now") Instant now);

    // Only clears the pointer if it still refers to this order
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DriverAvailability d SET d.currentOrderId = null, d.updatedAt = :now " +
            "WHERE d.driverId = :driverId AND d.currentOrderId = :orderId")
    int finishDelivery(@Param("driverId") UUID driverId, @Param("orderId") UUID orderId, @Param("now") Instant now);
}
