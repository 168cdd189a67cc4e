package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.OrderStatus;
import com.drycleaning.domain.entity.OrderStatusHistory;

import java.time.LocalDateTime;

public record OrderStatusHistoryResponse(
    OrderStatus fromStatus,
    OrderStatus toStatus,
    Long changedBy,
    String notes,
    LocalDateTime changedAt
) {

    public static OrderStatusHistoryResponse from(OrderStatusHistory history) {
        return new OrderStatusHistoryResponse(
                history.getFromStatus(),
                history.getToStatus(),
                history.getChangedBy(),
                history.getNotes(),
                history.getChangedAt()
        );
    }
}
