package com.drycleaning.application.scheduler;

import com.drycleaning.application.event.OrderEvent;
import com.drycleaning.application.event.OrderEventType;
import com.drycleaning.application.service.NotificationDispatcher;
import com.drycleaning.application.service.OutboxRecorder;
import com.drycleaning.domain.entity.OrderStatus;
import com.drycleaning.domain.entity.OutboxEvent;
import com.drycleaning.domain.entity.OutboxStatus;
import com.drycleaning.domain.repository.OutboxEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Outbox 재처리 배치 테스트")
class OutboxRetrySchedulerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 9, 0);

    @Mock
    private OutboxEventRepository outboxEventRepository;

    @Mock
    private OutboxRecorder outboxRecorder;

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private OutboxRetryScheduler scheduler;

    private final OrderEvent orderEvent = new OrderEvent(OrderEventType.CREATED, 1L, "ORD-2025-0001", 5L, 10L,
            null, OrderStatus.RECEIVED, 0, NOW);

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T00:00:00Z"), ZoneId.of("Asia/Seoul"));
        scheduler = new OutboxRetryScheduler(outboxEventRepository, outboxRecorder, notificationDispatcher, clock);
    }

    private OutboxEvent outbox(int failures) {
        OutboxEvent event = new OutboxEvent(OutboxRecorder.EVENT_TYPE_ORDER_NOTIFICATION, "{\"orderId\":1}", null, NOW);
        for (int i = 0; i < failures; i++) {
            event.markAsFailed("error");
        }
        return event;
    }

    @Test
    @DisplayName("PENDING 상태의 이벤트가 재처리되어 PROCESSED로 변경된다")
    void pendingEvents_shouldBeProcessed() {
        // given
        OutboxEvent event = outbox(0);
        when(outboxEventRepository.findByStatus(OutboxStatus.PENDING)).thenReturn(List.of(event));
        when(outboxEventRepository.findByStatus(OutboxStatus.FAILED)).thenReturn(List.of());
        when(outboxRecorder.readEvent(event)).thenReturn(orderEvent);

        // when
        scheduler.retryFailedEvents();

        // then
        assertThat(event.getStatus()).isEqualTo(OutboxStatus.PROCESSED);
        assertThat(event.getProcessedAt()).isNotNull();
        verify(notificationDispatcher).dispatch(orderEvent);
    }

    @Test
    @DisplayName("알림 생성에 실패하면 FAILED 상태로 변경되고 retryCount가 증가한다")
    void whenDispatchFails_statusShouldBeFailed() {
        // given
        OutboxEvent event = outbox(0);
        when(outboxEventRepository.findByStatus(OutboxStatus.PENDING)).thenReturn(List.of(event));
        when(outboxEventRepository.findByStatus(OutboxStatus.FAILED)).thenReturn(List.of());
        when(outboxRecorder.readEvent(event)).thenReturn(orderEvent);
        when(notificationDispatcher.dispatch(any())).thenThrow(new IllegalStateException("db down"));

        // when
        scheduler.retryFailedEvents();

        // then
        assertThat(event.getStatus()).isEqualTo(OutboxStatus.FAILED);
        assertThat(event.getRetryCount()).isEqualTo(1);
        assertThat(event.getLastError()).isEqualTo("db down");
    }

    @Test
    @DisplayName("최대 재시도 횟수 초과 시 더 이상 재시도하지 않는다")
    void maxRetryExceeded_shouldNotRetry() {
        // given
        OutboxEvent event = outbox(OutboxRetryScheduler.MAX_RETRY_COUNT);
        when(outboxEventRepository.findByStatus(OutboxStatus.PENDING)).thenReturn(List.of());
        when(outboxEventRepository.findByStatus(OutboxStatus.FAILED)).thenReturn(List.of(event));

        // when
        scheduler.retryFailedEvents();

        // then
        assertThat(event.getStatus()).isEqualTo(OutboxStatus.FAILED);
        assertThat(event.getRetryCount()).isEqualTo(3);
        verifyNoInteractions(notificationDispatcher, outboxRecorder);
    }

    @Test
    @DisplayName("FAILED 상태의 이벤트도 재시도하여 성공하면 PROCESSED로 변경된다")
    void failedEvents_canBeRetried() {
        OutboxEvent event = outbox(1);
        when(outboxEventRepository.findByStatus(OutboxStatus.PENDING)).thenReturn(List.of());
        when(outboxEventRepository.findByStatus(OutboxStatus.FAILED)).thenReturn(List.of(event));
        when(outboxRecorder.readEvent(event)).thenReturn(orderEvent);

        scheduler.retryFailedEvents();

        assertThat(event.getStatus()).isEqualTo(OutboxStatus.PROCESSED);
    }
}
