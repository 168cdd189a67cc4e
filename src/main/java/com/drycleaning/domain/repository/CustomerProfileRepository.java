package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.CustomerProfile;
import com.drycleaning.domain.entity.MembershipTier;
import com.drycleaning.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface CustomerProfileRepository {

    CustomerProfile save(CustomerProfile profile);

    Optional<CustomerProfile> findByAccountId(Long accountId);

    default CustomerProfile getByAccountIdOrThrow(Long accountId) {
        return findByAccountId(accountId)
                .orElseThrow(() -> BusinessException.notFound("고객 프로필", accountId));
    }

    Optional<CustomerProfile> findByAccountIdForUpdate(Long accountId);

    boolean existsByAccountId(Long accountId);

    /**
     * 매장에 주문 이력이 있는 고객 프로필을 최근 주문 순으로 조회합니다.
     *
     * @param search 이름/연락처/이메일 부분 일치 (null이면 전체)
     * @param tier 회원 등급 (null이면 전체)
     */
    List<CustomerProfile> findShopCustomers(Long shopId, String search, MembershipTier tier);
}
