package com.drycleaning.application.event;

/**
 * 도메인 이벤트 발행 추상화 인터페이스
 *
 * 기본 구현은 Spring Event(SpringEventPublisher),
 * kafka 프로파일에서는 KafkaEventPublisher가 사용된다.
 * 어느 구현이든 트랜잭션 안에서 호출되며 커밋 이후에만 전달된다.
 */
public interface DomainEventPublisher {

    void publish(Object event);
}
