package com.drycleaning.application.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * 인프로세스 DomainEventPublisher (kafka 프로파일이 아닐 때)
 *
 * 주문 이벤트만 발행하며, 커밋 이후 처리는 NotificationEventHandler의 AFTER_COMMIT 리스너가 맡는다.
 * KafkaEventPublisher와 같은 이벤트만 통과시켜 두 경로의 동작을 맞춘다.
 */
@Slf4j
@Component
@Profile("!kafka")
@RequiredArgsConstructor
public class SpringEventPublisher implements DomainEventPublisher {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publish(Object event) {
        if (!(event instanceof OrderEvent orderEvent)) {
            log.warn("Unknown event type: {}", event.getClass().getName());
            return;
        }
        log.debug("주문 이벤트 발행: type={}, orderId={}, status={}",
                orderEvent.type(), orderEvent.orderId(), orderEvent.newStatus());
        applicationEventPublisher.publishEvent(orderEvent);
    }
}
