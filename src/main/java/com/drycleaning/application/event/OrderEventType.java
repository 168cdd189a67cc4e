package com.drycleaning.application.event;

public enum OrderEventType {
    CREATED,
    STATUS_CHANGED
}
