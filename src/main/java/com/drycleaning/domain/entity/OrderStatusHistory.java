package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 주문 상태 변경 이력 Entity
 * 최초 접수 시에는 fromStatus가 비어 있습니다.
 */
@Entity
@Table(name = "order_status_histories",
        indexes = @Index(name = "idx_order_status_histories_order_id", columnList = "order_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OrderStatusHistory extends BaseEntity {

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_status", length = 20)
    private OrderStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_status", nullable = false, length = 20)
    private OrderStatus toStatus;

    @Column(name = "changed_by", nullable = false)
    private Long changedBy;

    @Column(name = "changed_at", nullable = false)
    private LocalDateTime changedAt;

    @Column(name = "notes", length = 500)
    private String notes;

    public OrderStatusHistory(Long orderId, OrderStatus fromStatus, OrderStatus toStatus,
                              Long changedBy, String notes, LocalDateTime changedAt) {
        if (orderId == null) {
            throw new IllegalArgumentException("주문 ID는 필수입니다");
        }
        if (toStatus == null) {
            throw new IllegalArgumentException("변경 상태는 필수입니다");
        }
        if (changedBy == null) {
            throw new IllegalArgumentException("변경자는 필수입니다");
        }
        this.orderId = orderId;
        this.fromStatus = fromStatus;
        this.toStatus = toStatus;
        this.changedBy = changedBy;
        this.notes = notes;
        this.changedAt = changedAt;
    }
}
