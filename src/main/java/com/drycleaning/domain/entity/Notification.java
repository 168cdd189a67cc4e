package com.drycleaning.domain.entity;

import com.drycleaning.domain.entity.base.BaseEntity;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 인앱 알림 Entity
 */
@Entity
@Table(name = "notifications",
        indexes = @Index(name = "idx_notifications_recipient_status", columnList = "recipient_id, status"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Notification extends BaseEntity {

    @Column(name = "recipient_id", nullable = false)
    private Long recipientId;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "shop_id")
    private Long shopId;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_type", nullable = false, length = 30)
    private NotificationType type;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "message", nullable = false, columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 10)
    private NotificationPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private NotificationStatus status;

    @Column(name = "read_at")
    private LocalDateTime readAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public Notification(Long recipientId, Long orderId, Long shopId, NotificationType type,
                        String title, String message, NotificationPriority priority, LocalDateTime now) {
        if (recipientId == null) {
            throw new IllegalArgumentException("수신자는 필수입니다");
        }
        if (type == null) {
            throw new IllegalArgumentException("알림 타입은 필수입니다");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("알림 제목은 필수입니다");
        }
        this.recipientId = recipientId;
        this.orderId = orderId;
        this.shopId = shopId;
        this.type = type;
        this.title = title;
        this.message = message;
        this.priority = priority != null ? priority : NotificationPriority.NORMAL;
        this.status = NotificationStatus.UNREAD;
        this.createdAt = now;
    }

    public void markAsRead(LocalDateTime now) {
        if (this.status == NotificationStatus.UNREAD) {
            this.status = NotificationStatus.READ;
            this.readAt = now;
        }
    }

    public boolean isFor(Long accountId) {
        return recipientId.equals(accountId);
    }
}
