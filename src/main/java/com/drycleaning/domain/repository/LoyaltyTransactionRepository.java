package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.LoyaltyTransaction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 포인트 거래 Repository 인터페이스
 */
public interface LoyaltyTransactionRepository {

    LoyaltyTransaction save(LoyaltyTransaction transaction);

    Page<LoyaltyTransaction> findByCustomerId(Long customerId, Pageable pageable);

    List<LoyaltyTransaction> findByCustomerId(Long customerId);

    /**
     * 사용 가능한 적립 거래를 만료일이 빠른 순(만료 없음은 마지막)으로 잠금과 함께 조회합니다.
     */
    List<LoyaltyTransaction> findAvailableCreditsForUpdate(Long customerId, LocalDateTime now);

    /**
     * 만료되었지만 잔량이 남은 적립 거래를 잠금과 함께 조회합니다.
     */
    List<LoyaltyTransaction> findExpiredCreditsForUpdate(Long customerId, LocalDateTime now);

    List<Long> findCustomerIdsWithExpiredCredits(LocalDateTime now);
}
