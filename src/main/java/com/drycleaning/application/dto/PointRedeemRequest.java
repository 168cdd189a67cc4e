package com.drycleaning.application.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record PointRedeemRequest(
    @NotNull(message = "사용 포인트는 필수입니다")
    @Positive(message = "사용 포인트는 0보다 커야 합니다")
    Integer points,

    @Size(max = 500, message = "설명은 500자 이하여야 합니다")
    String description,

    Long orderId
) {}
