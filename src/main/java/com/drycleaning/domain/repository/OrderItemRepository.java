package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.OrderItem;

import java.util.Collection;
import java.util.List;

public interface OrderItemRepository {

    OrderItem save(OrderItem orderItem);

    List<OrderItem> saveAll(List<OrderItem> orderItems);

    List<OrderItem> findByOrderId(Long orderId);

    List<OrderItem> findByOrderIdIn(Collection<Long> orderIds);

    void delete(OrderItem orderItem);

    void deleteByOrderId(Long orderId);
}
