package com.drycleaning.domain.entity;

import java.time.LocalDateTime;

/**
 * 주문 생성 시 함께 저장되는 부가 정보
 */
public record OrderDetails(
        OrderPriority priority,
        PickupType pickupType,
        String customerName,
        String customerPhone,
        String pickupAddress,
        String specialInstructions,
        LocalDateTime pickupAt,
        LocalDateTime deliveryAt
) {
}
