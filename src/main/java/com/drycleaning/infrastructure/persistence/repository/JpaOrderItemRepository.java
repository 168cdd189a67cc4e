package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.OrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface JpaOrderItemRepository extends JpaRepository<OrderItem, Long> {
    List<OrderItem> findByOrderIdOrderByIdAsc(Long orderId);

    List<OrderItem> findByOrderIdIn(Collection<Long> orderIds);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM OrderItem i WHERE i.orderId = :orderId")
    void deleteByOrderId(@Param("orderId") Long orderId);
}
