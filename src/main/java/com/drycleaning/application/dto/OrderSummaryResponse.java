package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.entity.OrderPriority;
import com.drycleaning.domain.entity.OrderStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record OrderSummaryResponse(
    Long orderId,
    String orderNumber,
    Long shopId,
    Long customerId,
    OrderStatus status,
    OrderPriority priority,
    BigDecimal totalAmount,
    LocalDateTime pickupAt,
    LocalDateTime deliveryAt,
    LocalDateTime createdAt
) {

    public static OrderSummaryResponse from(Order order) {
        return new OrderSummaryResponse(
                order.getId(),
                order.getOrderNumber(),
                order.getShopId(),
                order.getCustomerId(),
                order.getStatus(),
                order.getPriority(),
                order.getTotalAmount().getAmount(),
                order.getPickupAt(),
                order.getDeliveryAt(),
                order.getCreatedAt()
        );
    }
}
