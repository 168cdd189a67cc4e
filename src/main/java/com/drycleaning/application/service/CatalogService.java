package com.drycleaning.application.service;

import com.drycleaning.application.access.AccessControl;
import com.drycleaning.application.access.Capability;
import com.drycleaning.application.dto.*;
import com.drycleaning.config.CaffeineCacheConfig;
import com.drycleaning.domain.entity.CleaningService;
import com.drycleaning.domain.entity.Item;
import com.drycleaning.domain.entity.ServicePrice;
import com.drycleaning.domain.entity.Shop;
import com.drycleaning.domain.repository.CleaningServiceRepository;
import com.drycleaning.domain.repository.ItemRepository;
import com.drycleaning.domain.repository.ServicePriceRepository;
import com.drycleaning.domain.repository.ShopRepository;
import com.drycleaning.domain.vo.Money;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 매장 카탈로그(세탁 서비스, 품목, 서비스 가격) 서비스
 *
 * 주문 가능한 가격표는 Caffeine 캐시에 보관하며, 카탈로그가 바뀌면 해당 매장 캐시를 비웁니다.
 * 가격 변경은 이미 생성된 주문 항목의 단가에 영향을 주지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogService {

    private final AccessControl accessControl;
    private final ShopRepository shopRepository;
    private final CleaningServiceRepository cleaningServiceRepository;
    private final ItemRepository itemRepository;
    private final ServicePriceRepository servicePriceRepository;
    private final Clock clock;

    @Cacheable(value = CaffeineCacheConfig.SHOP_CATALOG_CACHE, key = "#shopId")
    @Transactional(readOnly = true)
    public CatalogResponse getCatalog(Long shopId) {
        Shop shop = shopRepository.getByIdOrThrow(shopId);
        List<ServicePrice> prices = servicePriceRepository.findOrderableByShopId(shopId);

        Map<Long, String> itemNames = itemRepository.findByShopId(shopId).stream()
                .collect(Collectors.toMap(Item::getId, Item::getName));
        Map<Long, String> serviceNames = cleaningServiceRepository.findByShopId(shopId).stream()
                .collect(Collectors.toMap(CleaningService::getId, CleaningService::getName));

        log.debug("카탈로그 조회 (캐시 미스): shopId={}, prices={}", shopId, prices.size());
        return new CatalogResponse(shop.getId(), shop.getName(), prices.stream()
                .map(price -> ServicePriceResponse.of(price,
                        itemNames.get(price.getItemId()), serviceNames.get(price.getServiceId())))
                .toList());
    }

    @Transactional(readOnly = true)
    public List<CatalogEntryResponse> getServices(Long shopId) {
        return cleaningServiceRepository.findByShopId(shopId).stream()
                .map(CatalogEntryResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<CatalogEntryResponse> getItems(Long shopId) {
        return itemRepository.findByShopId(shopId).stream()
                .map(CatalogEntryResponse::from)
                .toList();
    }

    @CacheEvict(value = CaffeineCacheConfig.SHOP_CATALOG_CACHE, key = "#shopId")
    @Transactional
    public CatalogEntryResponse createService(Long accountId, Long shopId, CatalogEntryRequest request) {
        requireCatalogManager(accountId, shopId);
        if (cleaningServiceRepository.existsByShopIdAndName(shopId, request.name())) {
            throw new BusinessException(ErrorKind.DUPLICATE, "이미 등록된 서비스입니다: " + request.name());
        }
        LocalDateTime now = LocalDateTime.now(clock);
        CleaningService service = new CleaningService(shopId, request.name(), request.description(), now);
        if (!request.isActiveOrDefault()) {
            service.update(request.name(), request.description(), false, now);
        }
        CleaningService saved = cleaningServiceRepository.save(service);
        log.info("세탁 서비스 등록: shopId={}, serviceId={}, name={}", shopId, saved.getId(), saved.getName());
        return CatalogEntryResponse.from(saved);
    }

    @CacheEvict(value = CaffeineCacheConfig.SHOP_CATALOG_CACHE, key = "#shopId")
    @Transactional
    public CatalogEntryResponse updateService(Long accountId, Long shopId, Long serviceId, CatalogEntryRequest request) {
        requireCatalogManager(accountId, shopId);
        CleaningService service = findInShop(cleaningServiceRepository.getByIdOrThrow(serviceId),
                CleaningService::getShopId, shopId, "세탁 서비스", serviceId);
        if (!service.getName().equals(request.name())
                && cleaningServiceRepository.existsByShopIdAndName(shopId, request.name())) {
            throw new BusinessException(ErrorKind.DUPLICATE, "이미 등록된 서비스입니다: " + request.name());
        }
        service.update(request.name(), request.description(), request.isActiveOrDefault(), LocalDateTime.now(clock));
        return CatalogEntryResponse.from(cleaningServiceRepository.save(service));
    }

    @CacheEvict(value = CaffeineCacheConfig.SHOP_CATALOG_CACHE, key = "#shopId")
    @Transactional
    public CatalogEntryResponse createItem(Long accountId, Long shopId, CatalogEntryRequest request) {
        requireCatalogManager(accountId, shopId);
        if (itemRepository.existsByShopIdAndName(shopId, request.name())) {
            throw new BusinessException(ErrorKind.DUPLICATE, "이미 등록된 품목입니다: " + request.name());
        }
        LocalDateTime now = LocalDateTime.now(clock);
        Item item = new Item(shopId, request.name(), request.description(), now);
        if (!request.isActiveOrDefault()) {
            item.update(request.name(), request.description(), false, now);
        }
        Item saved = itemRepository.save(item);
        log.info("품목 등록: shopId={}, itemId={}, name={}", shopId, saved.getId(), saved.getName());
        return CatalogEntryResponse.from(saved);
    }

    @CacheEvict(value = CaffeineCacheConfig.SHOP_CATALOG_CACHE, key = "#shopId")
    @Transactional
    public CatalogEntryResponse updateItem(Long accountId, Long shopId, Long itemId, CatalogEntryRequest request) {
        requireCatalogManager(accountId, shopId);
        Item item = findInShop(itemRepository.getByIdOrThrow(itemId), Item::getShopId, shopId, "품목", itemId);
        if (!item.getName().equals(request.name()) && itemRepository.existsByShopIdAndName(shopId, request.name())) {
            throw new BusinessException(ErrorKind.DUPLICATE, "이미 등록된 품목입니다: " + request.name());
        }
        item.update(request.name(), request.description(), request.isActiveOrDefault(), LocalDateTime.now(clock));
        return CatalogEntryResponse.from(itemRepository.save(item));
    }

    @CacheEvict(value = CaffeineCacheConfig.SHOP_CATALOG_CACHE, key = "#shopId")
    @Transactional
    public ServicePriceResponse createPrice(Long accountId, Long shopId, ServicePriceRequest request) {
        requireCatalogManager(accountId, shopId);
        Item item = findInShop(itemRepository.getByIdOrThrow(request.itemId()),
                Item::getShopId, shopId, "품목", request.itemId());
        CleaningService service = findInShop(cleaningServiceRepository.getByIdOrThrow(request.serviceId()),
                CleaningService::getShopId, shopId, "세탁 서비스", request.serviceId());
        if (servicePriceRepository.existsByShopIdAndItemIdAndServiceId(shopId, item.getId(), service.getId())) {
            throw new BusinessException(ErrorKind.DUPLICATE,
                    "이미 가격이 등록되어 있습니다: itemId=" + item.getId() + ", serviceId=" + service.getId());
        }

        ServicePrice saved = servicePriceRepository.save(
                new ServicePrice(shopId, item, service, Money.of(request.price()), LocalDateTime.now(clock)));
        log.info("서비스 가격 등록: shopId={}, itemId={}, serviceId={}, price={}",
                shopId, item.getId(), service.getId(), saved.getPrice());
        return ServicePriceResponse.of(saved, item.getName(), service.getName());
    }

    @CacheEvict(value = CaffeineCacheConfig.SHOP_CATALOG_CACHE, key = "#shopId")
    @Transactional
    public ServicePriceResponse updatePrice(Long accountId, Long shopId, Long priceId, ServicePriceUpdateRequest request) {
        requireCatalogManager(accountId, shopId);
        ServicePrice price = findInShop(servicePriceRepository.getByIdOrThrow(priceId),
                ServicePrice::getShopId, shopId, "서비스 가격", priceId);
        Money previous = price.getPrice();
        price.update(Money.of(request.price()), request.isActiveOrDefault(), LocalDateTime.now(clock));
        ServicePrice saved = servicePriceRepository.save(price);

        log.info("서비스 가격 변경: priceId={}, {} → {}, active={}", priceId, previous, saved.getPrice(), saved.isActive());
        return ServicePriceResponse.of(saved,
                itemRepository.getByIdOrThrow(saved.getItemId()).getName(),
                cleaningServiceRepository.getByIdOrThrow(saved.getServiceId()).getName());
    }

    private void requireCatalogManager(Long accountId, Long shopId) {
        accessControl.resolve(accountId).require(Capability.MANAGE_CATALOG, shopId);
    }

    private <T> T findInShop(T entity, Function<T, Long> shopIdOf, Long shopId, String resource, Long id) {
        if (!Objects.equals(shopIdOf.apply(entity), shopId)) {
            throw BusinessException.notFound(resource, id);
        }
        return entity;
    }
}
