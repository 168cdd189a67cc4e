package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.OrderStatusHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface JpaOrderStatusHistoryRepository extends JpaRepository<OrderStatusHistory, Long> {
    List<OrderStatusHistory> findByOrderIdOrderByChangedAtAscIdAsc(Long orderId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM OrderStatusHistory h WHERE h.orderId = :orderId")
    void deleteByOrderId(@Param("orderId") Long orderId);
}
