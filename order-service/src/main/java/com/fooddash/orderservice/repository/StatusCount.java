package com.fooddash.orderservice.repository;

import com.fooddash.orderservice.model.OrderStatus;

// Row of the grouped status count query
public interface StatusCount {

    OrderStatus getStatus();

    Long getOrderCount();
}
