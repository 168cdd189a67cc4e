package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.ShopStaff;
import com.drycleaning.domain.repository.ShopStaffRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ShopStaffRepositoryImpl implements ShopStaffRepository {

    private final JpaShopStaffRepository jpaShopStaffRepository;

    @Override
    public ShopStaff save(ShopStaff staff) {
        return jpaShopStaffRepository.save(staff);
    }

    @Override
    public Optional<ShopStaff> findById(Long id) {
        return jpaShopStaffRepository.findById(id);
    }

    @Override
    public Optional<ShopStaff> findByAccountId(Long accountId) {
        return jpaShopStaffRepository.findByAccountId(accountId);
    }

    @Override
    public List<ShopStaff> findByShopId(Long shopId) {
        return jpaShopStaffRepository.findByShopId(shopId);
    }
}
