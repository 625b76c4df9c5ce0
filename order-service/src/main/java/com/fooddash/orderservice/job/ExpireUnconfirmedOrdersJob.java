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

// Cancels PENDING orders the vendor never confirmed
@Component
@RequiredArgsConstructor
public class ExpireUnconfirmedOrdersJob extends AbstractSweepJob {

  public static final String NAME = "expire-unconfirmed-orders";

  private final OrderRepository orderRepository;
  private final OrderStateMachine stateMachine;
  private final MaintenanceProperties properties;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected List<UUID> selectCandidates(Instant now) {
    return orderRepository.findUnconfirmedPlacedBefore(cutoff(now), PageRequest.of(0, properties.getBatchSize()));
  }

  @Override
  protected boolean applyToRow(UUID id, Instant now) {
    return stateMachine.expireUnconfirmed(id, cutoff(now), properties.getUnconfirmedOrders().getReason(), now);
  }

  private Instant cutoff(Instant now) {
    return now.minus(properties.getUnconfirmedOrders().getMaxAge());
  }
}
