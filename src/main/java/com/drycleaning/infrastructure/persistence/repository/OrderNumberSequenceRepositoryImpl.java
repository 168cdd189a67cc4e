package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.OrderNumberSequence;
import com.drycleaning.domain.repository.OrderNumberSequenceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class OrderNumberSequenceRepositoryImpl implements OrderNumberSequenceRepository {

    private final JpaOrderNumberSequenceRepository jpaOrderNumberSequenceRepository;

    @Override
    public Optional<OrderNumberSequence> findForUpdate(Long shopId, int year) {
        return jpaOrderNumberSequenceRepository.findForUpdate(shopId, year);
    }

    @Override
    public OrderNumberSequence saveAndFlush(OrderNumberSequence sequence) {
        return jpaOrderNumberSequenceRepository.saveAndFlush(sequence);
    }
}
