package com.fooddash.orderservice.job;

import com.fooddash.orderservice.config.MaintenanceProperties;
import com.fooddash.orderservice.repository.DriverAvailabilityRepository;
import com.fooddash.orderservice.service.DriverAvailabilityService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

// Drivers whose app stopped sending heartbeats are no longer offered as available
@Component
@RequiredArgsConstructor
public class ExpireStaleAvailabilityJob extends AbstractSweepJob {

  public static final String NAME = "expire-stale-availability";

  private final DriverAvailabilityRepository availabilityRepository;
  private final DriverAvailabilityService availabilityService;
  private final MaintenanceProperties properties;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected List<UUID> selectCandidates(Instant now) {
    return availabilityRepository.findStaleAvailable(cutoff(now), PageRequest.of(0, properties.getBatchSize()));
  }

  @Override
  protected boolean applyToRow(UUID id, Instant now) {
    return availabilityService.expireStale(id, cutoff(now), now);
  }

  private Instant cutoff(Instant now) {
    return now.minus(properties.getStaleAvailability().getMaxSilence());
  }
}
