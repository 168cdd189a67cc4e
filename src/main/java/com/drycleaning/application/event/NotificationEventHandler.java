package com.drycleaning.application.event;

import com.drycleaning.application.service.NotificationDispatcher;
import com.drycleaning.application.service.OutboxRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 이벤트 알림 핸들러
 *
 * 주문 트랜잭션 커밋 후 별도 스레드에서 알림을 생성한다.
 * 실패해도 주문 처리에는 영향이 없으며, 아웃박스에 저장되어 스케줄러가 재시도한다.
 *
 * kafka 프로파일에서는 NotificationKafkaConsumer가 대신 처리한다.
 */
@Slf4j
@Component
@Profile("!kafka")
@RequiredArgsConstructor
public class NotificationEventHandler {

    private final NotificationDispatcher notificationDispatcher;
    private final OutboxRecorder outboxRecorder;

    @Async("eventExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handle(OrderEvent event) {
        log.info("주문 알림 처리 시작: type={}, orderId={}", event.type(), event.orderId());

        try {
            notificationDispatcher.dispatch(event);
        } catch (Exception e) {
            log.error("주문 알림 처리 실패, 아웃박스에 저장: orderId={}", event.orderId(), e);
            outboxRecorder.record(event, e);
        }
    }
}
