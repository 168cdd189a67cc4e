package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 세탁 서비스 Entity (예: 드라이클리닝, 물세탁, 다림질)
 * 매장 내에서 서비스명은 중복될 수 없습니다.
 */
@Entity
@Table(name = "cleaning_services",
        uniqueConstraints = @UniqueConstraint(name = "uk_cleaning_services_shop_name", columnNames = {"shop_id", "name"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CleaningService extends BaseTimeEntity {

    @Column(name = "shop_id", nullable = false)
    private Long shopId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "active", nullable = false)
    private boolean active;

    public CleaningService(Long shopId, String name, String description, LocalDateTime now) {
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
            throw new IllegalArgumentException("서비스명은 필수입니다");
        }
        this.name = name;
        this.description = description;
    }
}
