package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseEntity;
import com.drycleaning.domain.vo.Money;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 주문 항목 Entity
 *
 * 주문 당시의 가격/품목명/서비스명을 스냅샷으로 저장하여
 * 이후 가격표 변경에 영향받지 않도록 합니다.
 */
@Entity
@Table(name = "order_items", indexes = @Index(name = "idx_order_items_order_id", columnList = "order_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderItem extends BaseEntity {

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "service_price_id", nullable = false)
    private Long servicePriceId;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "service_id", nullable = false)
    private Long serviceId;

    @Column(name = "snapshot_item_name", nullable = false, length = 100)
    private String snapshotItemName;

    @Column(name = "snapshot_service_name", nullable = false, length = 100)
    private String snapshotServiceName;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 10, scale = 2)
    private Money unitPrice;

    @Column(name = "total_price", nullable = false, updatable = false, precision = 12, scale = 2)
    private Money totalPrice;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public OrderItem(Long orderId, ServicePrice servicePrice, String itemName, String serviceName,
                     int quantity, String notes, LocalDateTime now) {
        if (orderId == null) {
            throw new IllegalArgumentException("주문 ID는 필수입니다");
        }
        if (servicePrice == null) {
            throw new BusinessException(ErrorKind.PRICING_NOT_FOUND);
        }
        if (quantity < 1) {
            throw new BusinessException(ErrorKind.INVALID_QUANTITY, "수량은 1개 이상이어야 합니다: " + quantity);
        }

        this.orderId = orderId;
        this.servicePriceId = servicePrice.getId();
        this.itemId = servicePrice.getItemId();
        this.serviceId = servicePrice.getServiceId();
        this.snapshotItemName = itemName;
        this.snapshotServiceName = serviceName;
        this.quantity = quantity;
        this.unitPrice = servicePrice.getPrice();
        this.totalPrice = this.unitPrice.multiply(quantity);
        this.notes = notes;
        this.createdAt = now;
    }
}
