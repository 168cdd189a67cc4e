package com.drycleaning.domain.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LoyaltyTransaction Entity 테스트")
class LoyaltyTransactionTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 10, 9, 0);

    @Test
    @DisplayName("적립 거래는 전체 포인트를 잔량으로 가진다")
    void earned_HasFullRemaining() {
        LoyaltyTransaction earned = LoyaltyTransaction.earned(1L, 100, 10L, "적립", NOW.plusDays(365), 2L, NOW);

        assertThat(earned.isCredit()).isTrue();
        assertThat(earned.getRemainingPoints()).isEqualTo(100);
        assertThat(earned.availablePoints(NOW)).isEqualTo(100);
    }

    @Test
    @DisplayName("사용 거래는 음수 포인트로 기록되고 잔량이 없다")
    void redeemed_IsNegative() {
        LoyaltyTransaction redeemed = LoyaltyTransaction.redeemed(1L, 30, null, "사용", 1L, NOW);

        assertThat(redeemed.getPoints()).isEqualTo(-30);
        assertThat(redeemed.getRemainingPoints()).isZero();
        assertThat(redeemed.availablePoints(NOW)).isZero();
    }

    @Test
    @DisplayName("만료 시각이 지나면 사용 가능 잔량은 0이다")
    void expiredCredit_HasNoAvailablePoints() {
        LoyaltyTransaction earned = LoyaltyTransaction.earned(1L, 100, 10L, "적립", NOW.plusDays(1), 2L, NOW);

        assertThat(earned.isExpired(NOW.plusDays(1))).isTrue();
        assertThat(earned.availablePoints(NOW.plusDays(1))).isZero();
        assertThat(earned.availablePoints(NOW.plusHours(23))).isEqualTo(100);
    }

    @Test
    @DisplayName("요청량이 잔량보다 크면 잔량만큼만 차감한다")
    void consume_CapsAtRemaining() {
        LoyaltyTransaction earned = LoyaltyTransaction.earned(1L, 40, 10L, "적립", null, 2L, NOW);

        assertThat(earned.consume(25)).isEqualTo(25);
        assertThat(earned.consume(25)).isEqualTo(15);
        assertThat(earned.getRemainingPoints()).isZero();
    }

    @Test
    @DisplayName("양수 조정은 만료 없는 적립으로 기록된다")
    void positiveAdjustment_NeverExpires() {
        LoyaltyTransaction adjustment = LoyaltyTransaction.adjustment(1L, 50, "보정", 2L, NOW);

        assertThat(adjustment.getExpiresAt()).isNull();
        assertThat(adjustment.availablePoints(NOW.plusYears(10))).isEqualTo(50);
    }

    @Test
    @DisplayName("0 포인트 거래는 생성할 수 없다")
    void zeroPoints_ThrowsException() {
        assertThatThrownBy(() -> LoyaltyTransaction.adjustment(1L, 0, "보정", 2L, NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LoyaltyTransaction.earned(1L, 0, 10L, "적립", null, 2L, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
