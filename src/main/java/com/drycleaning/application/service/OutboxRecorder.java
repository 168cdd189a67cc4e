package com.drycleaning.application.service;

import com.drycleaning.application.event.OrderEvent;
import com.drycleaning.domain.entity.OutboxEvent;
import com.drycleaning.domain.repository.OutboxEventRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 알림 전달에 실패한 주문 이벤트를 아웃박스에 JSON으로 저장하고 다시 읽어옵니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OutboxRecorder {

    public static final String EVENT_TYPE_ORDER_NOTIFICATION = "ORDER_NOTIFICATION";

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public OutboxEvent record(OrderEvent event, Throwable cause) {
        String error = cause != null ? cause.getMessage() : null;
        OutboxEvent outboxEvent = new OutboxEvent(EVENT_TYPE_ORDER_NOTIFICATION, toJson(event), error,
                LocalDateTime.now(clock));
        OutboxEvent saved = outboxEventRepository.save(outboxEvent);
        log.info("아웃박스 저장: outboxId={}, orderId={}", saved.getId(), event.orderId());
        return saved;
    }

    public OrderEvent readEvent(OutboxEvent outboxEvent) {
        try {
            return objectMapper.readValue(outboxEvent.getPayload(), OrderEvent.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("아웃박스 페이로드를 읽을 수 없습니다: outboxId=" + outboxEvent.getId(), e);
        }
    }

    private String toJson(OrderEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("주문 이벤트 직렬화 실패: orderId=" + event.orderId(), e);
        }
    }
}
