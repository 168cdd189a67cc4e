package com.drycleaning.interfaces.controller;

import com.drycleaning.api.CatalogApi;
import com.drycleaning.application.dto.*;
import com.drycleaning.application.service.CatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Validated
public class CatalogController implements CatalogApi {

    private final CatalogService catalogService;

    @Override
    public CatalogResponse getCatalog(Long shopId) {
        return catalogService.getCatalog(shopId);
    }

    @Override
    public List<CatalogEntryResponse> getServices(Long shopId) {
        return catalogService.getServices(shopId);
    }

    @Override
    public CatalogEntryResponse createService(Long accountId, Long shopId, CatalogEntryRequest request) {
        return catalogService.createService(accountId, shopId, request);
    }

    @Override
    public CatalogEntryResponse updateService(Long accountId, Long shopId, Long serviceId, CatalogEntryRequest request) {
        return catalogService.updateService(accountId, shopId, serviceId, request);
    }

    @Override
    public List<CatalogEntryResponse> getItems(Long shopId) {
        return catalogService.getItems(shopId);
    }

    @Override
    public CatalogEntryResponse createItem(Long accountId, Long shopId, CatalogEntryRequest request) {
        return catalogService.createItem(accountId, shopId, request);
    }

    @Override
    public CatalogEntryResponse updateItem(Long accountId, Long shopId, Long itemId, CatalogEntryRequest request) {
        return catalogService.updateItem(accountId, shopId, itemId, request);
    }

    @Override
    public ServicePriceResponse createPrice(Long accountId, Long shopId, ServicePriceRequest request) {
        return catalogService.createPrice(accountId, shopId, request);
    }

    @Override
    public ServicePriceResponse updatePrice(Long accountId, Long shopId, Long priceId, ServicePriceUpdateRequest request) {
        return catalogService.updatePrice(accountId, shopId, priceId, request);
    }
}
