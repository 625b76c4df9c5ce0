package com.fooddash.orderservice.job;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Select candidate ids, then apply one conditional write per row.
 *
 * Each row write runs in its own transaction (the target bean is transactional), so a failing
 * row is recorded in the report and the rest of the batch still runs. Only a failure of the
 * candidate query escapes {@link #run(Instant)}.
 */
@Slf4j
public abstract class AbstractSweepJob implements MaintenanceJob {

  protected abstract List<UUID> selectCandidates(Instant now);

  /**
   * @return true if the row was changed, false if it no longer matched
   */
  protected abstract boolean applyToRow(UUID id, Instant now);

  @Override
  public SweepReport run(Instant now) {
    List<UUID> candidates = selectCandidates(now);

    SweepReport.SweepReportBuilder report = SweepReport.builder()
        .jobName(name())
        .ranAt(now);
    int affected = 0;

    for (UUID id : candidates) {
      try {
        if (applyToRow(id, now)) {
          affected++;
        }
      } catch (RuntimeException e) {
        log.error("Sweep row failed: job={}, rowId={}", name(), id, e);
        report.rowError(new SweepReport.RowError(id, e.getMessage()));
      }
    }

    SweepReport result = report.rowsAffected(affected).build();
    if (result.hasErrors()) {
      log.warn("job={} rowsAffected={} rowErrors={} errors={}",
          name(), result.getRowsAffected(), result.getRowErrors().size(), result.getRowErrors());
    } else {
      log.info("job={} rowsAffected={} rowErrors=0 errors=[]", name(), result.getRowsAffected());
    }
    return result;
  }
}
