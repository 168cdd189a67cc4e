package com.drycleaning.domain.entity;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
