package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.OrderItem;

import java.math.BigDecimal;

public record OrderItemResponse(
    Long orderItemId,
    Long itemId,
    Long serviceId,
    String itemName,
    String serviceName,
    Integer quantity,
    BigDecimal unitPrice,
    BigDecimal totalPrice,
    String notes
) {

    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(
                item.getId(),
                item.getItemId(),
                item.getServiceId(),
                item.getSnapshotItemName(),
                item.getSnapshotServiceName(),
                item.getQuantity(),
                item.getUnitPrice().getAmount(),
                item.getTotalPrice().getAmount(),
                item.getNotes()
        );
    }
}
