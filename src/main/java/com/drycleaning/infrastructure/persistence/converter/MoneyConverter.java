package com.drycleaning.infrastructure.persistence.converter;

import com.drycleaning.domain.vo.Money;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.math.BigDecimal;

/**
 * Money ↔ DECIMAL(p, 2) 컬럼 변환
 *
 * 저장 시 소수점 둘째 자리로 고정된 값을 그대로 쓰고, 조회 시 Money.of로 같은 scale로 되돌린다.
 * 음수는 Money가 표현할 수 없으므로 손상된 데이터로 보고 IllegalStateException을 던진다.
 */
@Converter(autoApply = true)
public class MoneyConverter implements AttributeConverter<Money, BigDecimal> {

    @Override
    public BigDecimal convertToDatabaseColumn(Money money) {
        return money == null ? null : money.getAmount();
    }

    @Override
    public Money convertToEntityAttribute(BigDecimal amount) {
        if (amount == null) {
            return null;
        }
        if (amount.signum() < 0) {
            throw new IllegalStateException("저장된 금액이 음수입니다: " + amount.toPlainString());
        }
        return Money.of(amount);
    }
}
