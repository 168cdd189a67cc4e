package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.OrderStatus;

public record OrderStatusResponse(
    Long orderId,
    OrderStatus status
) {}
