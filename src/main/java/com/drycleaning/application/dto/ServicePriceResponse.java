package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.ServicePrice;

import java.math.BigDecimal;

public record ServicePriceResponse(
    Long id,
    Long shopId,
    Long itemId,
    String itemName,
    Long serviceId,
    String serviceName,
    BigDecimal price,
    boolean active
) {

    public static ServicePriceResponse of(ServicePrice price, String itemName, String serviceName) {
        return new ServicePriceResponse(
                price.getId(),
                price.getShopId(),
                price.getItemId(),
                itemName,
                price.getServiceId(),
                serviceName,
                price.getPrice().getAmount(),
                price.isActive()
        );
    }
}
