package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.CleaningService;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JpaCleaningServiceRepository extends JpaRepository<CleaningService, Long> {
    List<CleaningService> findByShopIdOrderByNameAsc(Long shopId);

    boolean existsByShopIdAndName(Long shopId, String name);
}
