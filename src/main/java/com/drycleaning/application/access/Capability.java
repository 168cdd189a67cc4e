package com.drycleaning.application.access;

/**
 * 매장 단위 권한
 */
public enum Capability {
    TAKE_ORDERS,          // 주문 접수, 항목 추가/삭제
    UPDATE_ORDERS,        // 주문 상태 변경
    REGISTER_CUSTOMERS,   // 신규 고객 등록
    VIEW_SHOP_ORDERS,     // 매장 주문 조회
    MANAGE_CATALOG,       // 서비스/품목/가격 관리
    MANAGE_STAFF,         // 직원 관리
    GRANT_POINTS,         // 보너스/조정 포인트 지급
    DELETE_ORDERS,        // 취소 주문 삭제
    VIEW_CUSTOMERS        // 고객 목록/분석/통계 조회 (점주 전용)
}
