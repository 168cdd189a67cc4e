package com.drycleaning.infrastructure.lock;

import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;

/**
 * 분산 락 획득 실패 예외
 * 응답에는 CONCURRENCY_CONFLICT로 노출됩니다.
 */
public class LockAcquisitionException extends BusinessException {

    public LockAcquisitionException(String message) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(ErrorKind.CONCURRENCY_CONFLICT, message, cause);
    }
}
