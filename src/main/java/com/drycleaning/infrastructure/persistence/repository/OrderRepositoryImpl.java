package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.entity.OrderStatus;
import com.drycleaning.domain.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class OrderRepositoryImpl implements OrderRepository {

    private final JpaOrderRepository jpaOrderRepository;

    @Override
    public Order save(Order order) {
        return jpaOrderRepository.save(order);
    }

    @Override
    public Optional<Order> findById(Long id) {
        return jpaOrderRepository.findById(id);
    }

    @Override
    public Optional<Order> findByIdForUpdate(Long id) {
        return jpaOrderRepository.findByIdForUpdate(id);
    }

    @Override
    public List<Order> findByCustomerId(Long customerId) {
        return jpaOrderRepository.findByCustomerIdOrderByCreatedAtDesc(customerId);
    }

    @Override
    public List<Order> findByShopId(Long shopId) {
        return jpaOrderRepository.findByShopIdOrderByCreatedAtDesc(shopId);
    }

    @Override
    public List<Order> findByShopIdAndStatus(Long shopId, OrderStatus status) {
        return jpaOrderRepository.findByShopIdAndStatusOrderByCreatedAtDesc(shopId, status);
    }

    @Override
    public List<Order> findByShopIdAndCustomerIdAndStatus(Long shopId, Long customerId, OrderStatus status) {
        return jpaOrderRepository.findByShopIdAndCustomerIdAndStatus(shopId, customerId, status);
    }

    @Override
    public boolean existsByCustomerIdAndShopId(Long customerId, Long shopId) {
        return jpaOrderRepository.existsByCustomerIdAndShopId(customerId, shopId);
    }

    @Override
    public void delete(Order order) {
        jpaOrderRepository.delete(order);
    }
}
