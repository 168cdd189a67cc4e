package com.drycleaning.application.event;

import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.entity.OrderStatus;

import java.time.LocalDateTime;

/**
 * 주문 이벤트
 *
 * 주문 생성/상태 변경 트랜잭션 안에서 발행되고, 커밋 이후(AFTER_COMMIT) 비동기로 알림에 전달된다.
 * 아웃박스 재처리를 위해 JSON으로 직렬화된다.
 */
public record OrderEvent(
        OrderEventType type,
        Long orderId,
        String orderNumber,
        Long shopId,
        Long customerId,
        OrderStatus oldStatus,
        OrderStatus newStatus,
        int pointsEarned,
        LocalDateTime timestamp
) {

    public static OrderEvent created(Order order, LocalDateTime timestamp) {
        return new OrderEvent(OrderEventType.CREATED, order.getId(), order.getOrderNumber(),
                order.getShopId(), order.getCustomerId(), null, order.getStatus(), 0, timestamp);
    }

    public static OrderEvent statusChanged(Order order, OrderStatus oldStatus, int pointsEarned,
                                           LocalDateTime timestamp) {
        return new OrderEvent(OrderEventType.STATUS_CHANGED, order.getId(), order.getOrderNumber(),
                order.getShopId(), order.getCustomerId(), oldStatus, order.getStatus(), pointsEarned, timestamp);
    }
}
