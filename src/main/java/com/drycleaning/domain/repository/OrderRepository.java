package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.entity.OrderStatus;
import com.drycleaning.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(Long id);

    default Order getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> BusinessException.notFound("주문", id));
    }

    /**
     * 비관적 락(SELECT ... FOR UPDATE)으로 주문을 조회합니다.
     * 트랜잭션 안에서만 호출해야 합니다.
     */
    Optional<Order> findByIdForUpdate(Long id);

    default Order getByIdForUpdateOrThrow(Long id) {
        return findByIdForUpdate(id)
                .orElseThrow(() -> BusinessException.notFound("주문", id));
    }

    List<Order> findByCustomerId(Long customerId);

    List<Order> findByShopId(Long shopId);

    List<Order> findByShopIdAndStatus(Long shopId, OrderStatus status);

    List<Order> findByShopIdAndCustomerIdAndStatus(Long shopId, Long customerId, OrderStatus status);

    boolean existsByCustomerIdAndShopId(Long customerId, Long shopId);

    void delete(Order order);
}
