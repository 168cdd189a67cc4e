package com.drycleaning.application.dto;

import java.util.List;

/**
 * 매장의 주문 가능한 가격표
 */
public record CatalogResponse(
    Long shopId,
    String shopName,
    List<ServicePriceResponse> prices
) {}
