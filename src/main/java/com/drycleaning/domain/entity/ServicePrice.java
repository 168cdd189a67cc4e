package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseTimeEntity;
import com.drycleaning.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 서비스 가격 Entity
 * (매장, 품목, 서비스) 조합마다 하나의 가격만 존재합니다.
 * 가격이 바뀌어도 이미 생성된 주문 항목의 단가는 바뀌지 않습니다.
 */
@Entity
@Table(name = "service_prices",
        uniqueConstraints = @UniqueConstraint(name = "uk_service_prices_shop_item_service",
                columnNames = {"shop_id", "item_id", "service_id"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ServicePrice extends BaseTimeEntity {

    @Column(name = "shop_id", nullable = false)
    private Long shopId;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private Money price;

    @Column(name = "active", nullable = false)
    private boolean active;

    public ServicePrice(Long shopId, Item item, CleaningService service, Money price, LocalDateTime now) {
        if (shopId == null) {
            throw new IllegalArgumentException("매장 ID는 필수입니다");
        }
        if (item == null || service == null) {
            throw new IllegalArgumentException("품목과 서비스는 필수입니다");
        }
        if (!shopId.equals(item.getShopId()) || !shopId.equals(service.getShopId())) {
            throw new IllegalArgumentException("품목과 서비스는 같은 매장에 속해야 합니다");
        }
        this.shopId = shopId;
        this.itemId = item.getId();
        this.serviceId = service.getId();
        this.active = true;
        changePrice(price);
        initializeTimestamps(now);
    }

    public void update(Money price, boolean active, LocalDateTime now) {
        changePrice(price);
        this.active = active;
        updateTimestamp(now);
    }

    private void changePrice(Money price) {
        if (price == null || price.isZero()) {
            throw new IllegalArgumentException("가격은 0보다 커야 합니다");
        }
        this.price = price;
    }
}
