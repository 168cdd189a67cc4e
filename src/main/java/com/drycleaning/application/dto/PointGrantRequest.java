package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.LoyaltyTransactionType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * 보너스(BONUS) 또는 수동 조정(ADJUSTMENT) 요청
 */
public record PointGrantRequest(
    @NotNull(message = "거래 타입은 필수입니다")
    LoyaltyTransactionType type,

    @NotNull(message = "포인트는 필수입니다")
    Integer points,

    @Size(max = 500, message = "설명은 500자 이하여야 합니다")
    String description
) {}
