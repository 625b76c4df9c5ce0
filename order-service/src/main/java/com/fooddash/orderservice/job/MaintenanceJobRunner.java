package com.fooddash.orderservice.job;

import com.fooddash.common.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Looks up sweep jobs by name and runs them against the current time.
 * Shared by the scheduler and the internal command endpoint.
 */
@Component
@Slf4j
public class MaintenanceJobRunner {

  private final Map<String, MaintenanceJob> jobs = new TreeMap<>();
  private final Clock clock;

  public MaintenanceJobRunner(List<MaintenanceJob> jobs, Clock clock) {
    for (MaintenanceJob job : jobs) {
      MaintenanceJob previous = this.jobs.put(job.name(), job);
      if (previous != null) {
        throw new IllegalStateException("Duplicate maintenance job name: " + job.name());
      }
    }
    this.clock = clock;
    log.info("Registered maintenance jobs: {}", this.jobs.keySet());
  }

  public SweepReport run(String jobName) {
    MaintenanceJob job = jobs.get(jobName);
    if (job == null) {
      throw new ResourceNotFoundException("Unknown maintenance job: " + jobName);
    }
    return job.run(clock.instant());
  }

  public List<String> jobNames() {
    return List.copyOf(jobs.keySet());
  }
}
