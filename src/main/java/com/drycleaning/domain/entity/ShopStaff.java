package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 매장 직원 Entity
 * 직원별 권한 플래그를 보관합니다. 한 계정은 한 매장에만 소속됩니다.
 */
@Entity
@Table(name = "shop_staff")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ShopStaff extends BaseTimeEntity {

    @Column(name = "shop_id", nullable = false)
    private Long shopId;

    @Column(name = "account_id", nullable = false, unique = true)
    private Long accountId;

    @Column(name = "position", length = 100)
    private String position;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "can_take_orders", nullable = false)
    private boolean canTakeOrders;

    @Column(name = "can_update_orders", nullable = false)
    private boolean canUpdateOrders;

    @Column(name = "can_register_customers", nullable = false)
    private boolean canRegisterCustomers;

    public ShopStaff(Long shopId, Long accountId, String position,
                     boolean canTakeOrders, boolean canUpdateOrders, boolean canRegisterCustomers,
                     LocalDateTime now) {
        if (shopId == null) {
            throw new IllegalArgumentException("매장 ID는 필수입니다");
        }
        if (accountId == null) {
            throw new IllegalArgumentException("계정 ID는 필수입니다");
        }
        this.shopId = shopId;
        this.accountId = accountId;
        this.position = position;
        this.active = true;
        this.canTakeOrders = canTakeOrders;
        this.canUpdateOrders = canUpdateOrders;
        this.canRegisterCustomers = canRegisterCustomers;
        initializeTimestamps(now);
    }

    public void updatePermissions(boolean canTakeOrders, boolean canUpdateOrders, boolean canRegisterCustomers,
                                  LocalDateTime now) {
        this.canTakeOrders = canTakeOrders;
        this.canUpdateOrders = canUpdateOrders;
        this.canRegisterCustomers = canRegisterCustomers;
        updateTimestamp(now);
    }

    public void activate(LocalDateTime now) {
        this.active = true;
        updateTimestamp(now);
    }

    public void deactivate(LocalDateTime now) {
        this.active = false;
        updateTimestamp(now);
    }
}
