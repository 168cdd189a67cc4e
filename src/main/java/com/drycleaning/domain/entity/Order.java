package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseTimeEntity;
import com.drycleaning.domain.vo.Money;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 Entity
 *
 * 주문 항목(OrderItem)은 간접 참조(ID 기반)로 관리하며,
 * 총액은 항목 합계로만 재계산됩니다. 직접 설정할 수 없습니다.
 */
@Entity
@Table(name = "orders",
        uniqueConstraints = @UniqueConstraint(name = "uk_orders_shop_order_number",
                columnNames = {"shop_id", "order_number"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Order extends BaseTimeEntity {

    @Column(name = "shop_id", nullable = false)
    private Long shopId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "order_number", nullable = false, length = 20)
    private String orderNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private OrderPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "pickup_type", nullable = false, length = 20)
    private PickupType pickupType;

    @Column(name = "customer_name", length = 100)
    private String customerName;

    @Column(name = "customer_phone", length = 20)
    private String customerPhone;

    @Column(name = "pickup_address", columnDefinition = "TEXT")
    private String pickupAddress;

    @Column(name = "special_instructions", columnDefinition = "TEXT")
    private String specialInstructions;

    @Column(name = "pickup_at", nullable = false)
    private LocalDateTime pickupAt;

    @Column(name = "delivery_at", nullable = false)
    private LocalDateTime deliveryAt;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private Money totalAmount;

    @Column(name = "created_by", nullable = false)
    private Long createdBy;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public Order(Long shopId, Long customerId, String orderNumber, Long createdBy,
                 OrderDetails details, LocalDateTime now) {
        if (shopId == null) {
            throw new IllegalArgumentException("매장 ID는 필수입니다");
        }
        if (customerId == null) {
            throw new IllegalArgumentException("고객 ID는 필수입니다");
        }
        if (orderNumber == null || orderNumber.isBlank()) {
            throw new IllegalArgumentException("주문 번호는 필수입니다");
        }
        if (details == null || details.pickupAt() == null || details.deliveryAt() == null) {
            throw new BusinessException(ErrorKind.INVALID_SCHEDULE, "픽업/배송 일시는 필수입니다");
        }

        this.shopId = shopId;
        this.customerId = customerId;
        this.orderNumber = orderNumber;
        this.createdBy = createdBy;
        this.status = OrderStatus.RECEIVED;
        this.priority = details.priority() != null ? details.priority() : OrderPriority.NORMAL;
        this.pickupType = details.pickupType() != null ? details.pickupType() : PickupType.DROP_OFF;
        this.customerName = details.customerName();
        this.customerPhone = details.customerPhone();
        this.pickupAddress = details.pickupAddress();
        this.specialInstructions = details.specialInstructions();
        this.pickupAt = details.pickupAt();
        this.deliveryAt = details.deliveryAt();
        this.totalAmount = Money.zero();
        initializeTimestamps(now);
    }

    /**
     * 상태를 변경합니다.
     *
     * @param target 변경할 상태
     * @param now 변경 시각
     * @return 변경 전 상태
     * @throws BusinessException INVALID_TRANSITION - 허용되지 않은 전이인 경우
     */
    public OrderStatus changeStatus(OrderStatus target, LocalDateTime now) {
        if (!status.canTransitionTo(target)) {
            throw new BusinessException(ErrorKind.INVALID_TRANSITION,
                    "주문 상태를 변경할 수 없습니다: " + status + " → " + target);
        }
        OrderStatus previous = this.status;
        this.status = target;
        if (target == OrderStatus.COMPLETED) {
            this.completedAt = now;
        } else if (target == OrderStatus.CANCELLED) {
            this.cancelledAt = now;
        }
        updateTimestamp(now);
        return previous;
    }

    /**
     * 항목 추가/삭제 가능 여부를 검증합니다.
     */
    public void ensureItemsModifiable() {
        if (!status.allowsItemChanges()) {
            throw new BusinessException(ErrorKind.INVALID_TRANSITION,
                    "현재 상태에서는 주문 항목을 변경할 수 없습니다: " + status);
        }
    }

    /**
     * 항목 합계로 총액을 다시 계산합니다.
     */
    public void recalculateTotal(List<OrderItem> items, LocalDateTime now) {
        this.totalAmount = items.stream()
                .map(OrderItem::getTotalPrice)
                .reduce(Money.zero(), Money::add);
        updateTimestamp(now);
    }

    public boolean isOwnedBy(Long accountId) {
        return customerId.equals(accountId);
    }
}
