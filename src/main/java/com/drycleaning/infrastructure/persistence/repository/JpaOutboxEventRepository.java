package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.OutboxEvent;
import com.drycleaning.domain.entity.OutboxStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JpaOutboxEventRepository extends JpaRepository<OutboxEvent, Long> {
    List<OutboxEvent> findByStatusOrderByIdAsc(OutboxStatus status);
}
