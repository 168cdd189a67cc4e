package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.OrderStatusHistory;

import java.util.List;

public interface OrderStatusHistoryRepository {

    OrderStatusHistory save(OrderStatusHistory history);

    /**
     * 주문의 상태 이력을 변경 순서대로 조회합니다.
     */
    List<OrderStatusHistory> findByOrderId(Long orderId);

    void deleteByOrderId(Long orderId);
}
