package com.drycleaning.domain.entity;

/**
 * 주문 우선순위
 */
public enum OrderPriority {
    NORMAL,
    HIGH,
    URGENT
}
