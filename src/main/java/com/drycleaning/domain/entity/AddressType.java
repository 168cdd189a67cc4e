package com.drycleaning.domain.entity;

/**
 * 주소 유형
 */
public enum AddressType {
    HOME,   // 자택
    WORK,   // 직장
    OTHER   // 기타
}
