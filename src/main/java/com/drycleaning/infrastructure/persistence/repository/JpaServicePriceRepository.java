package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.ServicePrice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface JpaServicePriceRepository extends JpaRepository<ServicePrice, Long> {

    @Query("SELECT p FROM ServicePrice p, Item i, CleaningService s " +
            "WHERE p.itemId = i.id AND p.serviceId = s.id " +
            "AND p.shopId = :shopId AND p.itemId = :itemId AND p.serviceId = :serviceId " +
            "AND p.active = true AND i.active = true AND s.active = true")
    Optional<ServicePrice> findOrderable(@Param("shopId") Long shopId,
                                         @Param("itemId") Long itemId,
                                         @Param("serviceId") Long serviceId);

    @Query("SELECT p FROM ServicePrice p, Item i, CleaningService s " +
            "WHERE p.itemId = i.id AND p.serviceId = s.id " +
            "AND p.shopId = :shopId AND p.active = true AND i.active = true AND s.active = true " +
            "ORDER BY i.name, s.name")
    List<ServicePrice> findOrderableByShopId(@Param("shopId") Long shopId);

    boolean existsByShopIdAndItemIdAndServiceId(Long shopId, Long itemId, Long serviceId);
}
