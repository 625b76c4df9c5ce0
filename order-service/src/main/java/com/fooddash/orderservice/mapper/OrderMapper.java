package com.fooddash.orderservice.mapper;

import com.fooddash.orderservice.dto.AvailableOrderResponse;
import com.fooddash.orderservice.dto.DriverAvailabilityResponse;
import com.fooddash.orderservice.dto.OrderItemResponse;
import com.fooddash.orderservice.dto.OrderResponse;
import com.fooddash.orderservice.dto.OrderStatusHistoryResponse;
import com.fooddash.orderservice.model.DriverAvailability;
import com.fooddash.orderservice.model.Order;
import com.fooddash.orderservice.model.OrderItem;
import com.fooddash.orderservice.model.OrderStatusHistory;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    OrderResponse toOrderResponse(Order order);

    List<OrderResponse> toOrderResponses(List<Order> orders);

    // (@Mapping not needed here since source and target field names are the same)
    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    AvailableOrderResponse toAvailableOrderResponse(Order order);

    List<AvailableOrderResponse> toAvailableOrderResponses(List<Order> orders);

    OrderStatusHistoryResponse toHistoryResponse(OrderStatusHistory history);

    List<OrderStatusHistoryResponse> toHistoryResponses(List<OrderStatusHistory> history);

    DriverAvailabilityResponse toAvailabilityResponse(DriverAvailability availability);
}
