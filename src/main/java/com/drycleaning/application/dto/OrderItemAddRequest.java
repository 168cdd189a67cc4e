package com.drycleaning.application.dto;

import com.drycleaning.domain.service.OrderLine;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record OrderItemAddRequest(
    @NotNull(message = "품목 ID는 필수입니다")
    Long itemId,

    @NotNull(message = "서비스 ID는 필수입니다")
    Long serviceId,

    @NotNull(message = "수량은 필수입니다")
    @Max(value = 999, message = "수량은 999 이하여야 합니다")
    Integer quantity,

    @Size(max = 500, message = "메모는 500자 이하여야 합니다")
    String notes
) {

    public OrderLine toOrderLine() {
        return new OrderLine(itemId, serviceId, quantity, notes);
    }
}
