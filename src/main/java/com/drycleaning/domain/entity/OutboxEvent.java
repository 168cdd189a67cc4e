package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 아웃박스 이벤트 Entity
 * 알림 전달에 실패한 주문 이벤트를 재전송을 위해 보관합니다.
 */
@Entity
@Table(name = "outbox_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OutboxEvent extends BaseEntity {

    @Column(name = "event_type", nullable = false, length = 50)
    private String eventType;

    @Column(name = "payload", nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OutboxStatus status;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;

    public OutboxEvent(String eventType, String payload, String lastError, LocalDateTime now) {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("이벤트 타입은 필수입니다");
        }
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("페이로드는 필수입니다");
        }
        this.eventType = eventType;
        this.payload = payload;
        this.status = OutboxStatus.PENDING;
        this.retryCount = 0;
        this.lastError = truncate(lastError);
        this.createdAt = now;
    }

    public void markAsProcessed(LocalDateTime now) {
        this.status = OutboxStatus.PROCESSED;
        this.processedAt = now;
    }

    public void markAsFailed(String error) {
        this.status = OutboxStatus.FAILED;
        this.retryCount++;
        this.lastError = truncate(error);
    }

    public boolean canRetry(int maxRetryCount) {
        return this.retryCount < maxRetryCount && this.status != OutboxStatus.PROCESSED;
    }

    private static String truncate(String error) {
        if (error == null) {
            return null;
        }
        return error.length() > 500 ? error.substring(0, 500) : error;
    }
}
