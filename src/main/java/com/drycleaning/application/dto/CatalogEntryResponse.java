package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.CleaningService;
import com.drycleaning.domain.entity.Item;

public record CatalogEntryResponse(
    Long id,
    Long shopId,
    String name,
    String description,
    boolean active
) {

    public static CatalogEntryResponse from(CleaningService service) {
        return new CatalogEntryResponse(service.getId(), service.getShopId(), service.getName(),
                service.getDescription(), service.isActive());
    }

    public static CatalogEntryResponse from(Item item) {
        return new CatalogEntryResponse(item.getId(), item.getShopId(), item.getName(),
                item.getDescription(), item.isActive());
    }
}
