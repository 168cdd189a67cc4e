package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.Order;
import com.drycleaning.domain.entity.OrderStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface JpaOrderRepository extends JpaRepository<Order, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.id = :id")
    Optional<Order> findByIdForUpdate(@Param("id") Long id);

    List<Order> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    List<Order> findByShopIdOrderByCreatedAtDesc(Long shopId);

    List<Order> findByShopIdAndStatusOrderByCreatedAtDesc(Long shopId, OrderStatus status);

    List<Order> findByShopIdAndCustomerIdAndStatus(Long shopId, Long customerId, OrderStatus status);

    boolean existsByCustomerIdAndShopId(Long customerId, Long shopId);
}
