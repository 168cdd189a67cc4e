package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseTimeEntity;
import com.drycleaning.domain.vo.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 고객 프로필 Entity
 *
 * loyaltyPoints는 원장(LoyaltyTransaction)의 사용 가능 잔량 합계를 캐싱한 값입니다.
 */
@Entity
@Table(name = "customer_profiles")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CustomerProfile extends BaseTimeEntity {

    @Column(name = "account_id", nullable = false, unique = true)
    private Long accountId;

    @Column(name = "loyalty_points", nullable = false)
    private Integer loyaltyPoints;

    @Enumerated(EnumType.STRING)
    @Column(name = "membership_tier", nullable = false, length = 20)
    private MembershipTier membershipTier;

    @Column(name = "total_spent", nullable = false, precision = 12, scale = 2)
    private Money totalSpent;

    @Column(name = "total_orders", nullable = false)
    private Integer totalOrders;

    @Column(name = "first_order_at")
    private LocalDateTime firstOrderAt;

    @Column(name = "last_order_at")
    private LocalDateTime lastOrderAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    public CustomerProfile(Long accountId, LocalDateTime now) {
        if (accountId == null) {
            throw new IllegalArgumentException("계정 ID는 필수입니다");
        }
        this.accountId = accountId;
        this.loyaltyPoints = 0;
        this.membershipTier = MembershipTier.BRONZE;
        this.totalSpent = Money.zero();
        this.totalOrders = 0;
        initializeTimestamps(now);
    }

    /**
     * 완료된 주문을 누적 실적에 반영하고 등급을 재산정합니다.
     */
    public void recordCompletedOrder(Money orderTotal, LocalDateTime now) {
        this.totalSpent = this.totalSpent.add(orderTotal);
        this.totalOrders++;
        if (this.firstOrderAt == null) {
            this.firstOrderAt = now;
        }
        this.lastOrderAt = now;
        this.membershipTier = MembershipTier.of(this.totalSpent);
        updateTimestamp(now);
    }

    public void refreshBalance(int availablePoints, LocalDateTime now) {
        if (availablePoints < 0) {
            throw new IllegalArgumentException("포인트 잔액은 0 이상이어야 합니다");
        }
        this.loyaltyPoints = availablePoints;
        updateTimestamp(now);
    }
}
