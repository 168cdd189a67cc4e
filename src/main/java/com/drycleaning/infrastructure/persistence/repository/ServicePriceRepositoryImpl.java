package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.ServicePrice;
import com.drycleaning.domain.repository.ServicePriceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class ServicePriceRepositoryImpl implements ServicePriceRepository {

    private final JpaServicePriceRepository jpaServicePriceRepository;

    @Override
    public ServicePrice save(ServicePrice price) {
        return jpaServicePriceRepository.save(price);
    }

    @Override
    public Optional<ServicePrice> findById(Long id) {
        return jpaServicePriceRepository.findById(id);
    }

    @Override
    public Optional<ServicePrice> findOrderable(Long shopId, Long itemId, Long serviceId) {
        return jpaServicePriceRepository.findOrderable(shopId, itemId, serviceId);
    }

    @Override
    public List<ServicePrice> findOrderableByShopId(Long shopId) {
        return jpaServicePriceRepository.findOrderableByShopId(shopId);
    }

    @Override
    public boolean existsByShopIdAndItemIdAndServiceId(Long shopId, Long itemId, Long serviceId) {
        return jpaServicePriceRepository.existsByShopIdAndItemIdAndServiceId(shopId, itemId, serviceId);
    }
}
