package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.OrderItem;
import com.drycleaning.domain.repository.OrderItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class OrderItemRepositoryImpl implements OrderItemRepository {

    private final JpaOrderItemRepository jpaOrderItemRepository;

    @Override
    public OrderItem save(OrderItem orderItem) {
        return jpaOrderItemRepository.save(orderItem);
    }

    @Override
    public List<OrderItem> saveAll(List<OrderItem> orderItems) {
        return jpaOrderItemRepository.saveAll(orderItems);
    }

    @Override
    public List<OrderItem> findByOrderId(Long orderId) {
        return jpaOrderItemRepository.findByOrderIdOrderByIdAsc(orderId);
    }

    @Override
    public List<OrderItem> findByOrderIdIn(Collection<Long> orderIds) {
        if (orderIds.isEmpty()) {
            return List.of();
        }
        return jpaOrderItemRepository.findByOrderIdIn(orderIds);
    }

    @Override
    public void delete(OrderItem orderItem) {
        jpaOrderItemRepository.delete(orderItem);
    }

    @Override
    public void deleteByOrderId(Long orderId) {
        jpaOrderItemRepository.deleteByOrderId(orderId);
    }
}
