package com.fooddash.orderservice.job;

import com.fooddash.orderservice.config.MaintenanceProperties;
import com.fooddash.orderservice.repository.OrderRepository;
import com.fooddash.orderservice.service.OrderStateMachine;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

// Soft-archives DELIVERED and CANCELLED orders past the retention window. Rows are kept.
@Component
@RequiredArgsConstructor
public class ArchiveCompletedOrdersJob extends AbstractSweepJob {

  public static final String NAME = "archive-completed-orders";

  private final OrderRepository orderRepository;
  private final OrderStateMachine stateMachine;
  private final MaintenanceProperties properties;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected List<UUID> selectCandidates(Instant now) {
    return orderRepository.findArchivableCompletedBefore(cutoff(now), PageRequest.of(0, properties.getBatchSize()));
  }

  @Override
  protected boolean applyToRow(UUID id, Instant now) {
    return stateMachine.archiveCompleted(id, cutoff(now), now);
  }

  private Instant cutoff(Instant now) {
    return now.minus(properties.getCompletedOrders().getRetention());
  }
}
