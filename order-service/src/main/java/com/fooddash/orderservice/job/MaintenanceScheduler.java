package com.fooddash.orderservice.job;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Cron triggers for the sweeps. A failed run is logged and the next trigger tries again.
 * Disable with {@code maintenance.scheduling.enabled=false}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(prefix = "maintenance.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MaintenanceScheduler {

  private final MaintenanceJobRunner runner;

  @Scheduled(cron = "${maintenance.unconfirmed-orders.cron:0 * * * * *}")
  public void expireUnconfirmedOrders() {
    runSafely(ExpireUnconfirmedOrdersJob.NAME);
  }

  @Scheduled(cron = "${maintenance.completed-orders.cron:0 0 3 * * SUN}")
  public void archiveCompletedOrders() {
    runSafely(ArchiveCompletedOrdersJob.NAME);
  }

  @Scheduled(cron = "${maintenance.stale-availability.cron:0 */5 * * * *}")
  public void expireStaleAvailability() {
    runSafely(ExpireStaleAvailabilityJob.NAME);
  }

  void runSafely(String jobName) {
    try {
      runner.run(jobName);
    } catch (RuntimeException e) {
      log.error("Maintenance job failed: job={}, will retry on next trigger", jobName, e);
    }
  }
}
