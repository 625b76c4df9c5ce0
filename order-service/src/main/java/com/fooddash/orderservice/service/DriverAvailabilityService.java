package com.fooddash.orderservice.service;

import com.fooddash.common.exception.ResourceNotFoundException;
import com.fooddash.orderservice.dto.DriverAvailabilityResponse;
import com.fooddash.orderservice.mapper.OrderMapper;
import com.fooddash.orderservice.repository.DriverAvailabilityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-driver availability. Every write is a single statement; there is no read-modify-write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverAvailabilityService {

    private final DriverAvailabilityRepository availabilityRepository;
    private final OrderMapper orderMapper;
    private final Clock clock;

    @Transactional
    public DriverAvailabilityResponse heartbeat(UUID driverId) {
        return heartbeat(driverId, clock.instant());
    }

    /**
     * Records a heartbeat at {@code timestamp}, creating the availability row on first contact.
     * Concurrent heartbeats for one driver resolve last-write-wins.
     */
    @Transactional
    public DriverAvailabilityResponse heartbeat(UUID driverId, Instant timestamp) {
        availabilityRepository.upsertHeartbeat(driverId, timestamp, clock.instant());
        log.debug("Heartbeat recorded: driverId={}, at={}", driverId, timestamp);
        return getAvailability(driverId);
    }

    @Transactional
    public DriverAvailabilityResponse goOffline(UUID driverId) {
        int rows = availabilityRepository.markUnavailable(driverId, clock.instant());
        if (rows == 0) {
            throw new ResourceNotFoundException("No availability recorded for driver: " + driverId);
        }
        log.info("Driver went offline: driverId={}", driverId);
        return getAvailability(driverId);
    }

    @Transactional(readOnly = true)
    public DriverAvailabilityResponse getAvailability(UUID driverId) {
        return availabilityRepository.findById(driverId)
                .map(orderMapper::toAvailabilityResponse)
                .orElseThrow(() -> new ResourceNotFoundException("No availability recorded for driver: " + driverId));
    }

    /**
     * Flips the driver unavailable only if the row is still available and its last heartbeat
     * is older than {@code heartbeatBefore}. A heartbeat that landed after candidate selection wins.
     *
     * @return true if the row was flipped
     */
    @Transactional
    public boolean expireStale(UUID driverId, Instant heartbeatBefore, Instant now) {
        return availabilityRepository.markUnavailableIfStale(driverId, heartbeatBefore, now) == 1;
    }

    // Joins the caller's transaction so the pointer moves together with the order row
    @Transactional
    public void startDelivery(UUID driverId, UUID orderId, Instant now) {
        int rows = availabilityRepository.startDelivery(driverId, orderId, now);
        if (rows == 0) {
            log.debug("Driver {} has no availability row, current order not recorded", driverId);
        }
    }

    @Transactional
    public void finishDelivery(UUID driverId, UUID orderId, Instant now) {
        availabilityRepository.finishDelivery(driverId, orderId, now);
    }
}
