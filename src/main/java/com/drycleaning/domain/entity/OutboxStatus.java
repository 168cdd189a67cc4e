package com.drycleaning.domain.entity;

/**
 * 아웃박스 이벤트 상태
 */
public enum OutboxStatus {
    PENDING,    // 재전송 대기
    PROCESSED,  // 전송 완료
    FAILED      // 재전송 실패
}
