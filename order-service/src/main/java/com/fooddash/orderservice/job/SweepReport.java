package com.fooddash.orderservice.job;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class SweepReport {

  String jobName;
  Instant ranAt;
  int rowsAffected;
  @Singular
  List<RowError> rowErrors;

  public boolean hasErrors() {
    return !rowErrors.isEmpty();
  }

  @Value
  public static class RowError {
    UUID rowId;
    String message;
  }
}
