package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.CustomerProfile;
import com.drycleaning.domain.entity.MembershipTier;
import com.drycleaning.domain.repository.CustomerProfileRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class CustomerProfileRepositoryImpl implements CustomerProfileRepository {

    private final JpaCustomerProfileRepository jpaCustomerProfileRepository;

    @Override
    public CustomerProfile save(CustomerProfile profile) {
        return jpaCustomerProfileRepository.save(profile);
    }

    @Override
    public Optional<CustomerProfile> findByAccountId(Long accountId) {
        return jpaCustomerProfileRepository.findByAccountId(accountId);
    }

    @Override
    public Optional<CustomerProfile> findByAccountIdForUpdate(Long accountId) {
        return jpaCustomerProfileRepository.findByAccountIdForUpdate(accountId);
    }

    @Override
    public boolean existsByAccountId(Long accountId) {
        return jpaCustomerProfileRepository.existsByAccountId(accountId);
    }

    @Override
    public List<CustomerProfile> findShopCustomers(Long shopId, String search, MembershipTier tier) {
        String pattern = (search == null || search.isBlank())
                ? null
                : "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
        return jpaCustomerProfileRepository.findShopCustomers(shopId, pattern, tier);
    }
}
