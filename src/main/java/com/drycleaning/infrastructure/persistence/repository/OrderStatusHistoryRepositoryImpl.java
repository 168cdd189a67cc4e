package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.OrderStatusHistory;
import com.drycleaning.domain.repository.OrderStatusHistoryRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class OrderStatusHistoryRepositoryImpl implements OrderStatusHistoryRepository {

    private final JpaOrderStatusHistoryRepository jpaOrderStatusHistoryRepository;

    @Override
    public OrderStatusHistory save(OrderStatusHistory history) {
        return jpaOrderStatusHistoryRepository.save(history);
    }

    @Override
    public List<OrderStatusHistory> findByOrderId(Long orderId) {
        return jpaOrderStatusHistoryRepository.findByOrderIdOrderByChangedAtAscIdAsc(orderId);
    }

    @Override
    public void deleteByOrderId(Long orderId) {
        jpaOrderStatusHistoryRepository.deleteByOrderId(orderId);
    }
}
