package com.drycleaning.domain.entity;

/**
 * 수거 방식
 */
public enum PickupType {
    DROP_OFF,   // 매장 방문 접수
    PICKUP      // 방문 수거
}
