package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.Notification;
import com.drycleaning.domain.entity.NotificationPriority;
import com.drycleaning.domain.entity.NotificationStatus;
import com.drycleaning.domain.entity.NotificationType;

import java.time.LocalDateTime;

public record NotificationResponse(
    Long id,
    NotificationType type,
    String title,
    String message,
    NotificationPriority priority,
    NotificationStatus status,
    Long orderId,
    Long shopId,
    LocalDateTime createdAt,
    LocalDateTime readAt
) {

    public static NotificationResponse from(Notification notification) {
        return new NotificationResponse(
                notification.getId(),
                notification.getType(),
                notification.getTitle(),
                notification.getMessage(),
                notification.getPriority(),
                notification.getStatus(),
                notification.getOrderId(),
                notification.getShopId(),
                notification.getCreatedAt(),
                notification.getReadAt()
        );
    }
}
