package com.drycleaning.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 에러 종류 정의
 *
 * 응답 본문의 error_kind 값으로 그대로 노출됩니다.
 * - 주문 상태 머신: INVALID_TRANSITION
 * - 주문 생성/항목 검증: PRICING_NOT_FOUND, INVALID_QUANTITY, EMPTY_ORDER, INVALID_SCHEDULE
 * - 포인트: INSUFFICIENT_POINTS
 * - 공통: FORBIDDEN, NOT_FOUND, CONCURRENCY_CONFLICT, STORAGE_FAILURE
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    INVALID_TRANSITION(HttpStatus.CONFLICT, "허용되지 않은 주문 상태 변경입니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "접근 권한이 없습니다."),
    PRICING_NOT_FOUND(HttpStatus.UNPROCESSABLE_ENTITY, "해당 품목/서비스의 가격이 등록되어 있지 않습니다."),
    INVALID_QUANTITY(HttpStatus.BAD_REQUEST, "수량은 1개 이상이어야 합니다."),
    EMPTY_ORDER(HttpStatus.BAD_REQUEST, "주문에는 최소 1개 이상의 항목이 있어야 합니다."),
    INVALID_SCHEDULE(HttpStatus.BAD_REQUEST, "픽업/배송 일정이 올바르지 않습니다."),
    INSUFFICIENT_POINTS(HttpStatus.BAD_REQUEST, "포인트가 부족합니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "요청한 리소스를 찾을 수 없습니다."),
    CONCURRENCY_CONFLICT(HttpStatus.CONFLICT, "동시성 충돌이 발생했습니다. 다시 시도해 주세요."),
    STORAGE_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "저장소 처리 중 오류가 발생했습니다."),
    VALIDATION_FAILED(HttpStatus.BAD_REQUEST, "잘못된 요청입니다."),
    DUPLICATE(HttpStatus.CONFLICT, "이미 존재하는 리소스입니다.");

    private final HttpStatus httpStatus;
    private final String message;

    public int getStatusCode() {
        return httpStatus.value();
    }
}
