package com.drycleaning.application.scheduler;

import com.drycleaning.application.service.LoyaltyService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 포인트 소멸 스케줄러
 * 매일 새벽 유효기간이 지난 적립분의 잔량을 EXPIRED 거래로 소멸시킨다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoyaltyExpiryScheduler {

    private final LoyaltyService loyaltyService;

    @Scheduled(cron = "${drycleaning.loyalty.expiry-cron:0 0 3 * * *}")
    public void expirePoints() {
        int processed = loyaltyService.expirePoints();
        if (processed > 0) {
            log.info("포인트 소멸 처리 완료: customers={}", processed);
        }
    }
}
