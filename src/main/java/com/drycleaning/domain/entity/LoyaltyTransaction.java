package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 포인트 거래 Entity
 *
 * 추가만 가능한 원장입니다. 적립성 거래(양수)는 remainingPoints로 미사용 잔량을 관리하고,
 * 사용/소멸 시 만료일이 빠른 순서로 차감됩니다.
 */
@Entity
@Table(name = "loyalty_transactions",
        indexes = @Index(name = "idx_loyalty_transactions_customer_id", columnList = "customer_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoyaltyTransaction extends BaseEntity {

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "order_id")
    private Long orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "transaction_type", nullable = false, length = 20)
    private LoyaltyTransactionType type;

    @Column(name = "points", nullable = false)
    private Integer points;

    @Column(name = "remaining_points", nullable = false)
    private Integer remainingPoints;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;

    @Column(name = "processed_by")
    private Long processedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LoyaltyTransaction(Long customerId, LoyaltyTransactionType type, int points, String description,
                               Long orderId, LocalDateTime expiresAt, Long processedBy, LocalDateTime now) {
        if (customerId == null) {
            throw new IllegalArgumentException("고객 ID는 필수입니다");
        }
        if (type == null) {
            throw new IllegalArgumentException("거래 타입은 필수입니다");
        }
        if (points == 0) {
            throw new IllegalArgumentException("포인트는 0이 될 수 없습니다");
        }
        this.customerId = customerId;
        this.type = type;
        this.points = points;
        this.remainingPoints = points > 0 ? points : 0;
        this.description = description;
        this.orderId = orderId;
        this.expiresAt = expiresAt;
        this.processedBy = processedBy;
        this.createdAt = now;
    }

    public static LoyaltyTransaction earned(Long customerId, int points, Long orderId, String description,
                                            LocalDateTime expiresAt, Long processedBy, LocalDateTime now) {
        requirePositive(points);
        return new LoyaltyTransaction(customerId, LoyaltyTransactionType.EARNED, points, description,
                orderId, expiresAt, processedBy, now);
    }

    public static LoyaltyTransaction bonus(Long customerId, int points, String description,
                                           LocalDateTime expiresAt, Long processedBy, LocalDateTime now) {
        requirePositive(points);
        return new LoyaltyTransaction(customerId, LoyaltyTransactionType.BONUS, points, description,
                null, expiresAt, processedBy, now);
    }

    /**
     * 수동 조정. 양수면 만료 없는 적립, 음수면 차감입니다.
     */
    public static LoyaltyTransaction adjustment(Long customerId, int points, String description,
                                                Long processedBy, LocalDateTime now) {
        return new LoyaltyTransaction(customerId, LoyaltyTransactionType.ADJUSTMENT, points, description,
                null, null, processedBy, now);
    }

    public static LoyaltyTransaction redeemed(Long customerId, int points, Long orderId, String description,
                                              Long processedBy, LocalDateTime now) {
        requirePositive(points);
        return new LoyaltyTransaction(customerId, LoyaltyTransactionType.REDEEMED, -points, description,
                orderId, null, processedBy, now);
    }

    public static LoyaltyTransaction expired(Long customerId, int points, LocalDateTime now) {
        requirePositive(points);
        return new LoyaltyTransaction(customerId, LoyaltyTransactionType.EXPIRED, -points,
                "포인트 유효기간 만료", null, null, null, now);
    }

    private static void requirePositive(int points) {
        if (points <= 0) {
            throw new IllegalArgumentException("포인트는 0보다 커야 합니다: " + points);
        }
    }

    public boolean isCredit() {
        return points > 0;
    }

    public boolean isExpired(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * 현재 시점에 사용 가능한 잔량
     */
    public int availablePoints(LocalDateTime now) {
        return isCredit() && !isExpired(now) ? remainingPoints : 0;
    }

    /**
     * 미사용 잔량에서 최대 requested만큼 차감합니다.
     *
     * @return 실제로 차감된 포인트
     */
    public int consume(int requested) {
        int consumed = Math.min(requested, remainingPoints);
        this.remainingPoints -= consumed;
        return consumed;
    }
}
