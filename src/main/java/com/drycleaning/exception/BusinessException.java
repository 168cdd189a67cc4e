package com.drycleaning.exception;

import lombok.Getter;

/**
 * 비즈니스 로직 예외
 *
 * 사용 예시:
 * - throw new BusinessException(ErrorKind.EMPTY_ORDER);
 * - throw new BusinessException(ErrorKind.INVALID_TRANSITION, "완료된 주문은 상태를 변경할 수 없습니다: " + orderId);
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorKind errorKind;
    private final String customMessage;

    public BusinessException(ErrorKind errorKind) {
        super(errorKind.getMessage());
        this.errorKind = errorKind;
        this.customMessage = null;
    }

    public BusinessException(ErrorKind errorKind, String customMessage) {
        super(customMessage);
        this.errorKind = errorKind;
        this.customMessage = customMessage;
    }

    public BusinessException(ErrorKind errorKind, String customMessage, Throwable cause) {
        super(customMessage, cause);
        this.errorKind = errorKind;
        this.customMessage = customMessage;
    }

    public String getErrorMessage() {
        return customMessage != null ? customMessage : errorKind.getMessage();
    }

    public static BusinessException notFound(String resource, Object id) {
        return new BusinessException(ErrorKind.NOT_FOUND, resource + "을(를) 찾을 수 없습니다: " + id);
    }
}
