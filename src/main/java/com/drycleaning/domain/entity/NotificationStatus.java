package com.drycleaning.domain.entity;

public enum NotificationStatus {
    UNREAD,
    READ,
    ARCHIVED
}
