package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.OrderStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record OrderStatusChangeRequest(
    @NotNull(message = "변경할 상태는 필수입니다")
    OrderStatus status,

    @Size(max = 500, message = "메모는 500자 이하여야 합니다")
    String note
) {}
