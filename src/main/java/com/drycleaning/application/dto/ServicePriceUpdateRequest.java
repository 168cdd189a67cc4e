package com.drycleaning.application.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

public record ServicePriceUpdateRequest(
    @NotNull(message = "가격은 필수입니다")
    @DecimalMin(value = "0.01", message = "가격은 0보다 커야 합니다")
    @Digits(integer = 8, fraction = 2, message = "가격은 소수점 둘째 자리까지 입력할 수 있습니다")
    BigDecimal price,

    Boolean active
) {

    public boolean isActiveOrDefault() {
        return active == null || active;
    }
}
