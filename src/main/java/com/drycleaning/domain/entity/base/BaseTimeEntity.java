package com.drycleaning.domain.entity.base;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

/**
 * 생성/수정 시간을 관리하는 Entity 기본 클래스
 */
@MappedSuperclass
@Getter
public abstract class BaseTimeEntity extends BaseEntity {

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 영속화 이전(단위 테스트 등)에도 생성 시간을 확인할 수 있도록 초기화합니다.
     */
    protected void initializeTimestamps(LocalDateTime now) {
        this.createdAt = now;
        this.updatedAt = now;
    }

    public void updateTimestamp(LocalDateTime now) {
        this.updatedAt = now;
    }
}
