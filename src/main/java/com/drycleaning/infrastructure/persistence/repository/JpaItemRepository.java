package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.Item;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JpaItemRepository extends JpaRepository<Item, Long> {
    List<Item> findByShopIdOrderByNameAsc(Long shopId);

    boolean existsByShopIdAndName(Long shopId, String name);
}
