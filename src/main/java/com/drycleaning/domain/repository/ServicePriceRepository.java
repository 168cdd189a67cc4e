package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.ServicePrice;
import com.drycleaning.exception.BusinessException;

import java.util.List;
import java.util.Optional;

/**
 * 서비스 가격 Repository 인터페이스
 */
public interface ServicePriceRepository {

    ServicePrice save(ServicePrice price);

    Optional<ServicePrice> findById(Long id);

    default ServicePrice getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> BusinessException.notFound("서비스 가격", id));
    }

    /**
     * 주문 가능한 가격을 조회합니다.
     * 가격, 품목, 서비스가 모두 활성 상태인 경우에만 반환합니다.
     */
    Optional<ServicePrice> findOrderable(Long shopId, Long itemId, Long serviceId);

    List<ServicePrice> findOrderableByShopId(Long shopId);

    boolean existsByShopIdAndItemIdAndServiceId(Long shopId, Long itemId, Long serviceId);
}
