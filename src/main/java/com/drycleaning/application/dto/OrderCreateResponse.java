package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.entity.OrderStatus;

import java.math.BigDecimal;

public record OrderCreateResponse(
    Long orderId,
    String orderNumber,
    BigDecimal totalAmount,
    OrderStatus status
) {

    public static OrderCreateResponse from(Order order) {
        return new OrderCreateResponse(
                order.getId(),
                order.getOrderNumber(),
                order.getTotalAmount().getAmount(),
                order.getStatus()
        );
    }
}
