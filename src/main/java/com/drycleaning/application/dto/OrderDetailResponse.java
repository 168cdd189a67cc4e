package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

public record OrderDetailResponse(
    Long orderId,
    String orderNumber,
    Long shopId,
    Long customerId,
    OrderStatus status,
    OrderPriority priority,
    PickupType pickupType,
    String customerName,
    String customerPhone,
    String pickupAddress,
    String specialInstructions,
    LocalDateTime pickupAt,
    LocalDateTime deliveryAt,
    BigDecimal totalAmount,
    LocalDateTime createdAt,
    LocalDateTime completedAt,
    LocalDateTime cancelledAt,
    List<OrderItemResponse> items,
    List<OrderStatusHistoryResponse> history
) {

    public static OrderDetailResponse from(Order order, List<OrderItem> items, List<OrderStatusHistory> history) {
        return new OrderDetailResponse(
                order.getId(),
                order.getOrderNumber(),
                order.getShopId(),
                order.getCustomerId(),
                order.getStatus(),
                order.getPriority(),
                order.getPickupType(),
                order.getCustomerName(),
                order.getCustomerPhone(),
                order.getPickupAddress(),
                order.getSpecialInstructions(),
                order.getPickupAt(),
                order.getDeliveryAt(),
                order.getTotalAmount().getAmount(),
                order.getCreatedAt(),
                order.getCompletedAt(),
                order.getCancelledAt(),
                items.stream().map(OrderItemResponse::from).toList(),
                history.stream().map(OrderStatusHistoryResponse::from).toList()
        );
    }
}
