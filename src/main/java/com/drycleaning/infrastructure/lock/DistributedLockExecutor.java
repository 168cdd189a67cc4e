package com.drycleaning.infrastructure.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 분산 락 실행기
 *
 * Redisson RLock으로 고객 단위 포인트 작업을 직렬화합니다.
 *
 * 사용 예시:
 * - lockExecutor.executeWithLock("lock:loyalty:1", () -> loyaltyDomainService.redeem(...));
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DistributedLockExecutor {

    private static final long DEFAULT_WAIT_TIME_SECONDS = 10;
    private static final long DEFAULT_LEASE_TIME_SECONDS = 10;

    private final RedissonClient redissonClient;

    public <T> T executeWithLock(String lockKey, Supplier<T> task) {
        return executeWithLock(lockKey, DEFAULT_WAIT_TIME_SECONDS, DEFAULT_LEASE_TIME_SECONDS, task);
    }

    /**
     * 분산 락을 획득하고 작업을 실행합니다.
     *
     * @param lockKey 락 키
     * @param waitTimeSeconds 락 획득 대기 시간 (초)
     * @param leaseTimeSeconds 락 유지 시간 (초)
     * @param task 실행할 작업
     * @return 작업 결과
     * @throws LockAcquisitionException 대기 시간 안에 락을 얻지 못한 경우
     */
    public <T> T executeWithLock(String lockKey, long waitTimeSeconds, long leaseTimeSeconds, Supplier<T> task) {
        RLock lock = redissonClient.getLock(lockKey);

        try {
            boolean acquired = lock.tryLock(waitTimeSeconds, leaseTimeSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                log.warn("락 획득 실패: lockKey={}, waitTime={}s", lockKey, waitTimeSeconds);
                throw new LockAcquisitionException("락 획득 실패: " + lockKey);
            }

            return task.get();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("락 획득 중 인터럽트 발생: " + lockKey, e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
