package com.drycleaning.infrastructure.kafka.consumer;

import com.drycleaning.application.event.OrderEvent;
import com.drycleaning.application.service.NotificationDispatcher;
import com.drycleaning.application.service.OutboxRecorder;
import com.drycleaning.config.KafkaConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.annotation.DltHandler;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.annotation.RetryableTopic;
import org.springframework.kafka.retrytopic.DltStrategy;
import org.springframework.retry.annotation.Backoff;
import org.springframework.stereotype.Component;

/**
 * 주문 이벤트 알림 Consumer (kafka 프로파일)
 *
 * 실패 시 재시도 토픽으로 3회까지 재처리하고, 최종 실패 건은 아웃박스에 저장한다.
 */
@Slf4j
@Component
@Profile("kafka")
@RequiredArgsConstructor
public class NotificationKafkaConsumer {

    private final NotificationDispatcher notificationDispatcher;
    private final OutboxRecorder outboxRecorder;

    @RetryableTopic(
            attempts = "3",
            backoff = @Backoff(delay = 1000, multiplier = 2),
            dltStrategy = DltStrategy.FAIL_ON_ERROR
    )
    @KafkaListener(
            topics = KafkaConfig.TOPIC_ORDER_EVENTS,
            groupId = "notification-service"
    )
    public void consume(OrderEvent event) {
        log.info("Kafka 주문 알림 처리 시작: type={}, orderId={}", event.type(), event.orderId());
        notificationDispatcher.dispatch(event);
    }

    @DltHandler
    public void handleDlt(OrderEvent event) {
        log.error("[DLT] 주문 알림 최종 실패 - orderId={} | 아웃박스 재처리 대상", event.orderId());
        outboxRecorder.record(event, null);
    }
}
