package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.OutboxEvent;
import com.drycleaning.domain.entity.OutboxStatus;

import java.util.List;

/**
 * 아웃박스 이벤트 Repository 인터페이스
 */
public interface OutboxEventRepository {

    OutboxEvent save(OutboxEvent event);

    List<OutboxEvent> findByStatus(OutboxStatus status);
}
