package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.LoyaltyTransaction;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;

public interface JpaLoyaltyTransactionRepository extends JpaRepository<LoyaltyTransaction, Long> {

    Page<LoyaltyTransaction> findByCustomerIdOrderByCreatedAtDescIdDesc(Long customerId, Pageable pageable);

    List<LoyaltyTransaction> findByCustomerIdOrderByIdAsc(Long customerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM LoyaltyTransaction t " +
            "WHERE t.customerId = :customerId AND t.points > 0 AND t.remainingPoints > 0 " +
            "AND (t.expiresAt IS NULL OR t.expiresAt > :now) " +
            "ORDER BY CASE WHEN t.expiresAt IS NULL THEN 1 ELSE 0 END, t.expiresAt, t.id")
    List<LoyaltyTransaction> findAvailableCreditsForUpdate(@Param("customerId") Long customerId,
                                                           @Param("now") LocalDateTime now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM LoyaltyTransaction t " +
            "WHERE t.customerId = :customerId AND t.points > 0 AND t.remainingPoints > 0 " +
            "AND t.expiresAt IS NOT NULL AND t.expiresAt <= :now " +
            "ORDER BY t.expiresAt, t.id")
    List<LoyaltyTransaction> findExpiredCreditsForUpdate(@Param("customerId") Long customerId,
                                                         @Param("now") LocalDateTime now);

    @Query("SELECT DISTINCT t.customerId FROM LoyaltyTransaction t " +
            "WHERE t.points > 0 AND t.remainingPoints > 0 " +
            "AND t.expiresAt IS NOT NULL AND t.expiresAt <= :now")
    List<Long> findCustomerIdsWithExpiredCredits(@Param("now") LocalDateTime now);
}
