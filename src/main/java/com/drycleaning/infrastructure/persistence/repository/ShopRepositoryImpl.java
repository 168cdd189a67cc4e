package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.Shop;
import com.drycleaning.domain.repository.ShopRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ShopRepositoryImpl implements ShopRepository {

    private final JpaShopRepository jpaShopRepository;

    @Override
    public Shop save(Shop shop) {
        return jpaShopRepository.save(shop);
    }

    @Override
    public Optional<Shop> findById(Long id) {
        return jpaShopRepository.findById(id);
    }

    @Override
    public Optional<Shop> findByOwnerId(Long ownerId) {
        return jpaShopRepository.findByOwnerId(ownerId);
    }
}
