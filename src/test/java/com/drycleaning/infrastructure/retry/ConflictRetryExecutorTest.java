package com.drycleaning.infrastructure.retry;

import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.sql.SQLIntegrityConstraintViolationException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ConflictRetryExecutor 테스트")
class ConflictRetryExecutorTest {

    private final ConflictRetryExecutor executor = new ConflictRetryExecutor();

    @Test
    @DisplayName("첫 시도에서 충돌이 나면 한 번 더 실행한다")
    void retriesOnceOnConflict() {
        AtomicInteger attempts = new AtomicInteger();

        String result = executor.execute("test", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new ObjectOptimisticLockingFailureException("Order", 1L);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("재시도 후에도 충돌하면 CONCURRENCY_CONFLICT로 변환한다")
    void exhausted_ThrowsConcurrencyConflict() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("test", () -> {
            attempts.incrementAndGet();
            throw new CannotAcquireLockException("lock wait timeout");
        }))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.CONCURRENCY_CONFLICT);
        assertThat(attempts.get()).isEqualTo(ConflictRetryExecutor.MAX_ATTEMPTS);
    }

    @Test
    @DisplayName("유니크 키 중복(MySQL 1062)은 재시도 대상이다")
    void retriesOnDuplicateKey() {
        AtomicInteger attempts = new AtomicInteger();

        executor.execute("test", () -> {
            if (attempts.incrementAndGet() == 1) {
                throw new DataIntegrityViolationException("could not execute statement",
                        new SQLIntegrityConstraintViolationException(
                                "Duplicate entry '1-2025' for key 'uk_order_number_sequences_shop_year'",
                                "23000", 1062));
            }
        });

        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("DuplicateKeyException이 계속되면 CONCURRENCY_CONFLICT로 변환한다")
    void duplicateKey_Exhausted_ThrowsConcurrencyConflict() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("test", () -> {
            attempts.incrementAndGet();
            throw new DuplicateKeyException("duplicate profile");
        }))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.CONCURRENCY_CONFLICT);
        assertThat(attempts.get()).isEqualTo(ConflictRetryExecutor.MAX_ATTEMPTS);
    }

    @Test
    @DisplayName("값 범위 초과 같은 무결성 오류는 재시도하지 않고 그대로 전파한다")
    void outOfRange_NotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("createOrder", () -> {
            attempts.incrementAndGet();
            throw new DataIntegrityViolationException(
                    "Data truncation: Out of range value for column 'total_price'");
        }))
                .isExactlyInstanceOf(DataIntegrityViolationException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("비즈니스 예외는 재시도하지 않고 그대로 전파한다")
    void businessException_NotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("test", () -> {
            attempts.incrementAndGet();
            throw new BusinessException(ErrorKind.INVALID_TRANSITION);
        }))
                .isInstanceOf(BusinessException.class)
                .extracting("errorKind")
                .isEqualTo(ErrorKind.INVALID_TRANSITION);
        assertThat(attempts.get()).isEqualTo(1);
    }
}
