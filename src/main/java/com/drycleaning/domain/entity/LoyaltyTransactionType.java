package com.drycleaning.domain.entity;

/**
 * 포인트 거래 타입
 */
public enum LoyaltyTransactionType {
    EARNED,      // 주문 완료 적립
    REDEEMED,    // 사용
    EXPIRED,     // 소멸
    BONUS,       // 보너스 지급
    ADJUSTMENT;  // 수동 조정

    /**
     * 만료일이 있는 적립성 거래인지 확인합니다.
     */
    public boolean isExpiringCredit() {
        return this == EARNED || this == BONUS;
    }
}
