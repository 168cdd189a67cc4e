package com.drycleaning.domain.entity;

/**
 * 계정 역할
 */
public enum AccountRole {
    CUSTOMER,     // 고객
    STAFF,        // 매장 직원
    SHOP_OWNER,   // 매장 점주
    ADMIN         // 관리자
}
