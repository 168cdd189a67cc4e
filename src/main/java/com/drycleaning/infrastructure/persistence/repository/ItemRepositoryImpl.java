package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.Item;
import com.drycleaning.domain.repository.ItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ItemRepositoryImpl implements ItemRepository {

    private final JpaItemRepository jpaItemRepository;

    @Override
    public Item save(Item item) {
        return jpaItemRepository.save(item);
    }

    @Override
    public Optional<Item> findById(Long id) {
        return jpaItemRepository.findById(id);
    }

    @Override
    public List<Item> findByShopId(Long shopId) {
        return jpaItemRepository.findByShopIdOrderByNameAsc(shopId);
    }

    @Override
    public boolean existsByShopIdAndName(Long shopId, String name) {
        return jpaItemRepository.existsByShopIdAndName(shopId, name);
    }
}
