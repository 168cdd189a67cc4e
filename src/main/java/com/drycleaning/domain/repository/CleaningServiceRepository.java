package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.CleaningService;
import com.drycleaning.exception.BusinessException;

import java.util.List;
import java.util.Optional;

public interface CleaningServiceRepository {

    CleaningService save(CleaningService service);

    Optional<CleaningService> findById(Long id);

    default CleaningService getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> BusinessException.notFound("세탁 서비스", id));
    }

    List<CleaningService> findByShopId(Long shopId);

    boolean existsByShopIdAndName(Long shopId, String name);
}
