package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 매장 Entity
 * 점주 계정 한 개에 매장 한 개가 대응합니다.
 */
@Entity
@Table(name = "shops")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Shop extends BaseTimeEntity {

    @Column(name = "owner_id", nullable = false, unique = true)
    private Long ownerId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "address", columnDefinition = "TEXT")
    private String address;

    @Column(name = "phone", length = 20)
    private String phone;

    @Column(name = "active", nullable = false)
    private boolean active;

    public Shop(Long ownerId, String name, String address, String phone, LocalDateTime now) {
        if (ownerId == null) {
            throw new IllegalArgumentException("점주 ID는 필수입니다");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("매장명은 필수입니다");
        }
        this.ownerId = ownerId;
        this.name = name;
        this.address = address;
        this.phone = phone;
        this.active = true;
        initializeTimestamps(now);
    }

    public boolean isOwnedBy(Long accountId) {
        return ownerId.equals(accountId);
    }
}
