package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.Shop;
import com.drycleaning.exception.BusinessException;

import java.util.Optional;

public interface ShopRepository {

    Shop save(Shop shop);

    Optional<Shop> findById(Long id);

    default Shop getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> BusinessException.notFound("매장", id));
    }

    Optional<Shop> findByOwnerId(Long ownerId);
}
