package com.fooddash.orderservice.job;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.support.CronExpression;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {

  @Mock
  private MaintenanceJobRunner runner;

  @InjectMocks
  private MaintenanceScheduler scheduler;

  @Test
  void each_trigger_runs_its_job() {
    scheduler.expireUnconfirmedOrders();
    scheduler.archiveCompletedOrders();
    scheduler.expireStaleAvailability();

    verify(runner).run("expire-unconfirmed-orders");
    verify(runner).run("archive-completed-orders");
    verify(runner).run("expire-stale-availability");
  }

  @Test
  void fatal_failure_does_not_escape_the_trigger() {
    when(runner.run("expire-unconfirmed-orders"))
        .thenThrow(new DataAccessResourceFailureException("database down"));

    assertThatCode(() -> scheduler.expireUnconfirmedOrders()).doesNotThrowAnyException();
  }

  @ParameterizedTest
  @CsvSource({
      "expireUnconfirmedOrders, maintenance.unconfirmed-orders.cron",
      "archiveCompletedOrders, maintenance.completed-orders.cron",
      "expireStaleAvailability, maintenance.stale-availability.cron"
  })
  void cron_is_read_from_maintenance_key_with_valid_default(String method, String key) throws Exception {
    String cron = MaintenanceScheduler.class.getMethod(method).getAnnotation(Scheduled.class).cron();

    assertThat(cron).startsWith("${" + key + ":").endsWith("}");
    String fallback = cron.substring(key.length() + 3, cron.length() - 1);
    assertThatCode(() -> CronExpression.parse(fallback)).doesNotThrowAnyException();
  }
}
