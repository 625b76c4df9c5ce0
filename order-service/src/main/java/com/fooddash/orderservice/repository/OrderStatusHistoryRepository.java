package com.fooddash.orderservice.repository;

import com.fooddash.orderservice.model.OrderStatus;
import com.fooddash.orderservice.model.OrderStatusHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

// Append-only: only save() and reads are used
@Repository
public interface OrderStatusHistoryRepository extends JpaRepository<OrderStatusHistory, UUID> {

    List<OrderStatusHistory> findByOrderIdOrderByCreatedAtAsc(UUID orderId);

    long countByOrderIdAndToStatus(UUID orderId, OrderStatus toStatus);
}
