package com.fooddash.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "driver_availability", indexes = {
        @Index(name = "idx_driver_availability_heartbeat", columnList = "available, last_heartbeat_at")
})
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DriverAvailability {

    @Id // This IS the identity provider subject ID ('sub' claim) of the driver
    @Column(name = "driver_id")
    @ToString.Include
    private UUID driverId;

    @Builder.Default
    @Column(nullable = false)
    @ToString.Include
    private boolean available = false;

    @Column(name = "last_heartbeat_at", nullable = false)
    private Instant lastHeartbeatAt;

    // Order the driver is currently delivering, if any
    @Column(name = "current_order_id")
    private UUID currentOrderId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
