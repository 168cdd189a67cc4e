package com.drycleaning.domain.entity;

/**
 * 알림 타입
 */
public enum NotificationType {
    ORDER_CREATED,
    ORDER_STATUS_CHANGED,
    ORDER_READY,
    ORDER_COMPLETED,
    ORDER_CANCELLED,
    SYSTEM
}
