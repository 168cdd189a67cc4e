package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.OrderNumberSequence;

import java.util.Optional;

/**
 * 주문 번호 시퀀스 Repository 인터페이스
 */
public interface OrderNumberSequenceRepository {

    /**
     * (매장, 연도) 시퀀스 행을 잠금과 함께 조회합니다.
     */
    Optional<OrderNumberSequence> findForUpdate(Long shopId, int year);

    /**
     * 시퀀스 행을 즉시 INSERT 합니다.
     * 동시에 최초 생성되면 유니크 제약 위반(DataIntegrityViolationException)이 발생합니다.
     */
    OrderNumberSequence saveAndFlush(OrderNumberSequence sequence);
}
