package com.drycleaning.domain.service;

import com.drycleaning.domain.vo.Money;
import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 포인트 적립 정책
 *
 * 적립률(%)과 유효기간(일)은 설정값으로 주입됩니다.
 * 적립률은 0~100 범위만 허용하므로 적립 포인트는 주문 총액을 넘지 않습니다.
 */
@Getter
@Component
public class LoyaltyPolicy {

    public static final int MAX_EARN_RATE_PERCENT = 100;

    private final int earnRatePercent;
    private final int expiryDays;

    public LoyaltyPolicy(@Value("${drycleaning.loyalty.earn-rate-percent:10}") int earnRatePercent,
                         @Value("${drycleaning.loyalty.expiry-days:365}") int expiryDays) {
        if (earnRatePercent < 0 || earnRatePercent > MAX_EARN_RATE_PERCENT) {
            throw new IllegalArgumentException(
                    "적립률은 0 이상 " + MAX_EARN_RATE_PERCENT + " 이하여야 합니다: " + earnRatePercent);
        }
        if (expiryDays <= 0) {
            throw new IllegalArgumentException("포인트 유효기간은 1일 이상이어야 합니다: " + expiryDays);
        }
        this.earnRatePercent = earnRatePercent;
        this.expiryDays = expiryDays;
    }

    /**
     * 주문 총액에 대한 적립 포인트 (소수점 이하 버림)
     */
    public int pointsFor(Money orderTotal) {
        return orderTotal.percentFloor(earnRatePercent);
    }

    public LocalDateTime expiresAt(LocalDateTime now) {
        return now.plusDays(expiryDays);
    }
}
