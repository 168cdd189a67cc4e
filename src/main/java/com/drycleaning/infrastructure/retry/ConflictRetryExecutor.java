package com.drycleaning.infrastructure.retry;

import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * 동시성 충돌 재시도 실행기
 *
 * 트랜잭션 경계 밖에서 호출되어야 합니다. 충돌이 나면 트랜잭션 전체를 한 번 더 실행하고,
 * 그래도 실패하면 CONCURRENCY_CONFLICT로 변환합니다.
 *
 * 재시도 대상:
 * - 낙관적 락 버전 충돌
 * - 비관적 락 대기 실패/데드락
 * - 유니크 키 중복 (주문 번호 시퀀스/고객 프로필 최초 생성 경합)
 *
 * 값 범위 초과, 외래 키 위반 같은 그 밖의 무결성 오류는 재시도하지 않고 그대로 전파한다.
 */
@Slf4j
@Component
public class ConflictRetryExecutor {

    static final int MAX_ATTEMPTS = 2;
    private static final long BACKOFF_MILLIS = 50L;

    private static final int MYSQL_DUPLICATE_ENTRY = 1062;
    private static final String SQLSTATE_UNIQUE_VIOLATION = "23505";

    private final RetryTemplate retryTemplate;

    public ConflictRetryExecutor() {
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(MAX_ATTEMPTS)
                .fixedBackoff(BACKOFF_MILLIS)
                .retryOn(ObjectOptimisticLockingFailureException.class)
                .retryOn(PessimisticLockingFailureException.class)
                .retryOn(DuplicateKeyException.class)
                .traversingCauses()
                .build();
    }

    public <T> T execute(String operation, Supplier<T> task) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("동시성 충돌 재시도: operation={}, attempt={}",
                            operation, context.getRetryCount() + 1);
                }
                return runClassifyingDuplicates(task);
            });
        } catch (ObjectOptimisticLockingFailureException
                 | PessimisticLockingFailureException
                 | DuplicateKeyException e) {
            log.warn("동시성 충돌 재시도 초과: operation={}, error={}", operation, e.getMessage());
            throw new BusinessException(ErrorKind.CONCURRENCY_CONFLICT,
                    ErrorKind.CONCURRENCY_CONFLICT.getMessage(), e);
        }
    }

    public void execute(String operation, Runnable task) {
        execute(operation, () -> {
            task.run();
            return null;
        });
    }

    /**
     * JPA 경로에서는 유니크 키 중복도 DataIntegrityViolationException으로 올라오므로
     * 원인 SQLException을 보고 중복 키만 DuplicateKeyException으로 바꾼다.
     */
    private <T> T runClassifyingDuplicates(Supplier<T> task) {
        try {
            return task.get();
        } catch (DataIntegrityViolationException e) {
            if (e instanceof DuplicateKeyException || !isDuplicateKey(e)) {
                throw e;
            }
            throw new DuplicateKeyException(e.getMessage(), e);
        }
    }

    private boolean isDuplicateKey(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql
                    && (sql.getErrorCode() == MYSQL_DUPLICATE_ENTRY
                        || SQLSTATE_UNIQUE_VIOLATION.equals(sql.getSQLState()))) {
                return true;
            }
        }
        return false;
    }
}
