package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 의류 품목 Entity (예: 셔츠, 정장, 원피스)
 * 매장 내에서 품목명은 중복될 수 없습니다.
 */
@Entity
@Table(name = "items",
        uniqueConstraints = @UniqueConstraint(name = "uk_items_shop_name", columnNames = {"shop_id", "name"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Item extends BaseTimeEntity {

    @Column(name = "shop_id", nullable = false)
    private Long shopId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "active", nullable = false)
    private boolean active;

    public Item(Long shopId, String name, String description, LocalDateTime now) {
        if (shopId == null) {
            throw new IllegalArgumentException("매장 ID는 필수입니다");
        }
        this.shopId = shopId;
        this.active = true;
        rename(name, description);
        initializeTimestamps(now);
    }

    public void update(String name, String description, boolean active, LocalDateTime now) {
        rename(name, description);
        this.active = active;
        updateTimestamp(now);
    }

    private void rename(String name, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("품목명은 필수입니다");
        }
        this.name = name;
        this.description = description;
    }
}
