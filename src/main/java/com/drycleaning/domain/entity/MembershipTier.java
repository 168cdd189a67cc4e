package com.drycleaning.domain.entity;

import com.drycleaning.domain.vo.Money;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 회원 등급
 * 누적 결제 금액 기준으로 산정됩니다.
 */
@Getter
@RequiredArgsConstructor
public enum MembershipTier {
    BRONZE(Money.zero()),
    SILVER(Money.of("200")),
    GOLD(Money.of("500")),
    PLATINUM(Money.of("1000"));

    private final Money threshold;

    public static MembershipTier of(Money totalSpent) {
        MembershipTier result = BRONZE;
        for (MembershipTier tier : values()) {
            if (totalSpent.isGreaterThanOrEqual(tier.threshold)) {
                result = tier;
            }
        }
        return result;
    }
}
