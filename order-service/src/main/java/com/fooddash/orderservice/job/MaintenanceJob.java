package com.fooddash.orderservice.job;

import java.time.Instant;

/**
 * A time-driven sweep. Implementations must be idempotent: running twice with the same
 * {@code now} changes nothing the second time.
 */
public interface MaintenanceJob {

  String name();

  /**
   * Runs one sweep as of {@code now}.
   *
   * @throws org.springframework.dao.DataAccessException if candidates cannot be selected
   */
  SweepReport run(Instant now);
}
