package com.fooddash.orderservice.dto;

import lombok.Data;

import java.time.Instant;
import java.util.UUID;

@Data
public class DriverAvailabilityResponse {
    private UUID driverId;
    private boolean available;
    private Instant lastHeartbeatAt;
    private UUID currentOrderId;
}
