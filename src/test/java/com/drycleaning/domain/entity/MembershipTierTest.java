package com.drycleaning.domain.entity;

import com.drycleaning.domain.vo.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MembershipTier 테스트")
class MembershipTierTest {

    @ParameterizedTest(name = "누적 {0} → {1}")
    @CsvSource({
            "0, BRONZE",
            "199.99, BRONZE",
            "200, SILVER",
            "499.99, SILVER",
            "500, GOLD",
            "1000, PLATINUM",
            "25000, PLATINUM"
    })
    @DisplayName("누적 결제 금액으로 등급을 산정한다")
    void of(String totalSpent, MembershipTier expected) {
        assertThat(MembershipTier.of(Money.of(totalSpent))).isEqualTo(expected);
    }
}
