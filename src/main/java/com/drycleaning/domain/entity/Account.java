package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 계정 Entity
 * 인증은 외부에서 처리되며, 여기서는 역할 판별에 필요한 정보만 관리합니다.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Account extends BaseTimeEntity {

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "phone", nullable = false, unique = true, length = 20)
    private String phone;

    @Column(name = "email", length = 255)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private AccountRole role;

    public Account(String name, String phone, String email, AccountRole role, LocalDateTime now) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("이름은 필수입니다");
        }
        if (phone == null || phone.isBlank()) {
            throw new IllegalArgumentException("전화번호는 필수입니다");
        }
        if (role == null) {
            throw new IllegalArgumentException("역할은 필수입니다");
        }
        this.name = name;
        this.phone = phone;
        this.email = email;
        this.role = role;
        initializeTimestamps(now);
    }

    public boolean isCustomer() {
        return role == AccountRole.CUSTOMER;
    }
}
