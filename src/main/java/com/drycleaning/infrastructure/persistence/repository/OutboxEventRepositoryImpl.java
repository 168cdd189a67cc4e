package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.OutboxEvent;
import com.drycleaning.domain.entity.OutboxStatus;
import com.drycleaning.domain.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class OutboxEventRepositoryImpl implements OutboxEventRepository {

    private final JpaOutboxEventRepository jpaOutboxEventRepository;

    @Override
    public OutboxEvent save(OutboxEvent event) {
        return jpaOutboxEventRepository.save(event);
    }

    @Override
    public List<OutboxEvent> findByStatus(OutboxStatus status) {
        return jpaOutboxEventRepository.findByStatusOrderByIdAsc(status);
    }
}
