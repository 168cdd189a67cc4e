package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.ShopStaff;
import com.drycleaning.exception.BusinessException;

import java.util.List;
import java.util.Optional;

/**
 * 매장 직원 Repository 인터페이스
 */
public interface ShopStaffRepository {

    ShopStaff save(ShopStaff staff);

    Optional<ShopStaff> findById(Long id);

    default ShopStaff getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> BusinessException.notFound("직원", id));
    }

    Optional<ShopStaff> findByAccountId(Long accountId);

    List<ShopStaff> findByShopId(Long shopId);
}
