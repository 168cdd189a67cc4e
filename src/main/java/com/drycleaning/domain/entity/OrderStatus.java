package com.drycleaning.domain.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 주문 상태
 *
 * RECEIVED → IN_PROGRESS → READY_FOR_PICKUP → COMPLETED
 * CANCELLED는 완료 전 세 상태에서만 진입할 수 있으며, COMPLETED/CANCELLED는 종료 상태입니다.
 */
public enum OrderStatus {
    RECEIVED,           // 접수
    IN_PROGRESS,        // 처리 중
    READY_FOR_PICKUP,   // 수령 대기
    COMPLETED,          // 완료
    CANCELLED;          // 취소

    private static final Set<OrderStatus> MODIFIABLE = EnumSet.of(RECEIVED, IN_PROGRESS);

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    /**
     * 항목 추가/삭제가 가능한 상태인지 확인합니다.
     */
    public boolean allowsItemChanges() {
        return MODIFIABLE.contains(this);
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == CANCELLED) {
            return true;
        }
        return switch (this) {
            case RECEIVED -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == READY_FOR_PICKUP;
            case READY_FOR_PICKUP -> target == COMPLETED;
            default -> false;
        };
    }
}
