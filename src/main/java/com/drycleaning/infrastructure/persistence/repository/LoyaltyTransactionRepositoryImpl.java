package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.LoyaltyTransaction;
import com.drycleaning.domain.repository.LoyaltyTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class LoyaltyTransactionRepositoryImpl implements LoyaltyTransactionRepository {

    private final JpaLoyaltyTransactionRepository jpaLoyaltyTransactionRepository;

    @Override
    public LoyaltyTransaction save(LoyaltyTransaction transaction) {
        return jpaLoyaltyTransactionRepository.save(transaction);
    }

    @Override
    public Page<LoyaltyTransaction> findByCustomerId(Long customerId, Pageable pageable) {
        return jpaLoyaltyTransactionRepository.findByCustomerIdOrderByCreatedAtDescIdDesc(customerId, pageable);
    }

    @Override
    public List<LoyaltyTransaction> findByCustomerId(Long customerId) {
        return jpaLoyaltyTransactionRepository.findByCustomerIdOrderByIdAsc(customerId);
    }

    @Override
    public List<LoyaltyTransaction> findAvailableCreditsForUpdate(Long customerId, LocalDateTime now) {
        return jpaLoyaltyTransactionRepository.findAvailableCreditsForUpdate(customerId, now);
    }

    @Override
    public List<LoyaltyTransaction> findExpiredCreditsForUpdate(Long customerId, LocalDateTime now) {
        return jpaLoyaltyTransactionRepository.findExpiredCreditsForUpdate(customerId, now);
    }

    @Override
    public List<Long> findCustomerIdsWithExpiredCredits(LocalDateTime now) {
        return jpaLoyaltyTransactionRepository.findCustomerIdsWithExpiredCredits(now);
    }
}
