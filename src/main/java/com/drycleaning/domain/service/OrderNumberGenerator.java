package com.drycleaning.domain.service;

import com.drycleaning.domain.entity.OrderNumberSequence;
import com.drycleaning.domain.repository.OrderNumberSequenceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 주문 번호 발급기
 *
 * (매장, 연도) 시퀀스 행을 잠근 상태로 증가시키므로 반드시 주문 생성 트랜잭션 안에서 호출해야 합니다.
 * 번호는 트랜잭션이 커밋될 때 확정되며, 롤백되면 다음 주문이 같은 번호를 다시 받습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderNumberGenerator {

    private final OrderNumberSequenceRepository sequenceRepository;

    @Transactional(propagation = Propagation.MANDATORY)
    public String next(Long shopId, int year) {
        OrderNumberSequence sequence = sequenceRepository.findForUpdate(shopId, year)
                .orElseGet(() -> {
                    log.info("주문 번호 시퀀스 생성: shopId={}, year={}", shopId, year);
                    return sequenceRepository.saveAndFlush(new OrderNumberSequence(shopId, year));
                });
        return sequence.next();
    }
}
