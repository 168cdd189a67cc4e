package com.drycleaning.application.scheduler;

import com.drycleaning.application.event.OrderEvent;
import com.drycleaning.application.service.NotificationDispatcher;
import com.drycleaning.application.service.OutboxRecorder;
import com.drycleaning.domain.entity.OutboxEvent;
import com.drycleaning.domain.entity.OutboxStatus;
import com.drycleaning.domain.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outbox 재처리 배치 스케줄러
 *
 * 알림 전달 실패 건을 주기적으로 재시도한다.
 * - PENDING/FAILED 상태의 이벤트 조회
 * - 최대 재시도 횟수 초과 시 FAILED로 유지 (수동 처리 필요)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRetryScheduler {

    static final int MAX_RETRY_COUNT = 3;

    private final OutboxEventRepository outboxEventRepository;
    private final OutboxRecorder outboxRecorder;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${drycleaning.outbox.retry-interval-ms:60000}")
    public void retryFailedEvents() {
        List<OutboxEvent> candidates = new ArrayList<>(outboxEventRepository.findByStatus(OutboxStatus.PENDING));
        candidates.addAll(outboxEventRepository.findByStatus(OutboxStatus.FAILED));
        if (candidates.isEmpty()) {
            return;
        }

        log.info("Outbox 재처리 시작: count={}", candidates.size());
        int successCount = 0;
        int failCount = 0;

        for (OutboxEvent event : candidates) {
            if (!event.canRetry(MAX_RETRY_COUNT)) {
                log.warn("최대 재시도 횟수 초과, 수동 처리 필요: eventId={}, retryCount={}",
                        event.getId(), event.getRetryCount());
                continue;
            }
            if (processEvent(event)) {
                successCount++;
            } else {
                failCount++;
            }
        }

        log.info("Outbox 재처리 완료: success={}, fail={}", successCount, failCount);
    }

    private boolean processEvent(OutboxEvent event) {
        try {
            OrderEvent orderEvent = outboxRecorder.readEvent(event);
            notificationDispatcher.dispatch(orderEvent);
            event.markAsProcessed(LocalDateTime.now(clock));
            outboxEventRepository.save(event);
            log.debug("Outbox 이벤트 처리 성공: eventId={}", event.getId());
            return true;
        } catch (Exception e) {
            event.markAsFailed(e.getMessage());
            outboxEventRepository.save(event);
            log.error("Outbox 이벤트 처리 중 예외: eventId={}, retryCount={}, error={}",
                    event.getId(), event.getRetryCount(), e.getMessage());
            return false;
        }
    }
}
