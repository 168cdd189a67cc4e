package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.Item;
import com.drycleaning.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface ItemRepository {

    Item save(Item item);

    Optional<Item> findById(Long id);

    default Item getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> BusinessException.notFound("품목", id));
    }

    List<Item> findByShopId(Long shopId);

    boolean existsByShopIdAndName(Long shopId, String name);
}
