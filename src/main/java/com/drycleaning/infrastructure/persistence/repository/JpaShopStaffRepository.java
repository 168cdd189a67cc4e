package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.ShopStaff;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface JpaShopStaffRepository extends JpaRepository<ShopStaff, Long> {
    Optional<ShopStaff> findByAccountId(Long accountId);

    List<ShopStaff> findByShopId(Long shopId);
}
