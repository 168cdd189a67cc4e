package com.drycleaning.infrastructure.kafka;

import com.drycleaning.application.event.DomainEventPublisher;
import com.drycleaning.application.event.OrderEvent;
import com.drycleaning.config.KafkaConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Kafka 기반 DomainEventPublisher (kafka 프로파일)
 *
 * 주문 트랜잭션이 커밋된 뒤에만 메시지를 발행한다. 롤백되면 발행하지 않는다.
 */
@Slf4j
@Component
@Profile("kafka")
@RequiredArgsConstructor
public class KafkaEventPublisher implements DomainEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void publish(Object event) {
        if (!(event instanceof OrderEvent orderEvent)) {
            log.warn("Unknown event type: {}", event.getClass().getName());
            return;
        }

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    send(orderEvent);
                }
            });
        } else {
            send(orderEvent);
        }
    }

    /**
     * Key: orderId
     * 같은 주문의 이벤트는 같은 파티션으로 전달되어 순서가 보장된다.
     */
    private void send(OrderEvent event) {
        String key = event.orderId().toString();

        kafkaTemplate.send(KafkaConfig.TOPIC_ORDER_EVENTS, key, event)
                .whenComplete((result, ex) -> {
                    if (ex == null) {
                        log.info("Kafka 메시지 발행 성공: topic={}, key={}, offset={}",
                                KafkaConfig.TOPIC_ORDER_EVENTS, key, result.getRecordMetadata().offset());
                    } else {
                        log.error("Kafka 메시지 발행 실패: topic={}, key={}, error={}",
                                KafkaConfig.TOPIC_ORDER_EVENTS, key, ex.getMessage());
                    }
                });
    }
}
