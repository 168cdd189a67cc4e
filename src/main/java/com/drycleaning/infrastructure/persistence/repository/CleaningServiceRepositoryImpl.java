package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.CleaningService;
import com.drycleaning.domain.repository.CleaningServiceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class CleaningServiceRepositoryImpl implements CleaningServiceRepository {

    private final JpaCleaningServiceRepository jpaCleaningServiceRepository;

    @Override
    public CleaningService save(CleaningService service) {
        return jpaCleaningServiceRepository.save(service);
    }

    @Override
    public Optional<CleaningService> findById(Long id) {
        return jpaCleaningServiceRepository.findById(id);
    }

    @Override
    public List<CleaningService> findByShopId(Long shopId) {
        return jpaCleaningServiceRepository.findByShopIdOrderByNameAsc(shopId);
    }

    @Override
    public boolean existsByShopIdAndName(Long shopId, String name) {
        return jpaCleaningServiceRepository.existsByShopIdAndName(shopId, name);
    }
}
