package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.CustomerProfile;
import com.drycleaning.domain.entity.MembershipTier;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface JpaCustomerProfileRepository extends JpaRepository<CustomerProfile, Long> {
    Optional<CustomerProfile> findByAccountId(Long accountId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM CustomerProfile p WHERE p.accountId = :accountId")
    Optional<CustomerProfile> findByAccountIdForUpdate(@Param("accountId") Long accountId);

    boolean existsByAccountId(Long accountId);

    @Query("SELECT p FROM CustomerProfile p, Account a " +
            "WHERE a.id = p.accountId " +
            "AND EXISTS (SELECT o.id FROM Order o WHERE o.customerId = p.accountId AND o.shopId = :shopId) " +
            "AND (:tier IS NULL OR p.membershipTier = :tier) " +
            "AND (:pattern IS NULL OR LOWER(a.name) LIKE :pattern OR a.phone LIKE :pattern " +
            "OR LOWER(a.email) LIKE :pattern) " +
            "ORDER BY p.lastOrderAt DESC, p.id DESC")
    List<CustomerProfile> findShopCustomers(@Param("shopId") Long shopId,
                                            @Param("pattern") String pattern,
                                            @Param("tier") MembershipTier tier);
}
