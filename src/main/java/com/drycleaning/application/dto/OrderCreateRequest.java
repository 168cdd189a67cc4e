package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.OrderDetails;
import com.drycleaning.domain.entity.OrderPriority;
import com.drycleaning.domain.entity.PickupType;
import com.drycleaning.domain.service.OrderLine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 주문 생성 요청
 *
 * 수량/빈 주문/일정은 도메인에서 정해진 순서로 검증하므로 여기서는 형식만 검사합니다.
 * customerId가 없으면 요청자 본인의 주문입니다.
 */
public record OrderCreateRequest(
    Long customerId,

    List<@NotNull(message = "주문 항목은 null일 수 없습니다") @Valid OrderItemRequest> items,

    OrderPriority priority,

    PickupType pickupType,

    @Size(max = 100, message = "고객명은 100자 이하여야 합니다")
    String customerName,

    @Size(max = 20, message = "연락처는 20자 이하여야 합니다")
    String customerPhone,

    String pickupAddress,

    String specialInstructions,

    LocalDateTime pickupAt,

    LocalDateTime deliveryAt
) {

    public record OrderItemRequest(
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

    public List<OrderLine> toOrderLines() {
        if (items == null) {
            return List.of();
        }
        return items.stream()
                .map(OrderItemRequest::toOrderLine)
                .toList();
    }

    public OrderDetails toDetails() {
        return new OrderDetails(priority, pickupType, customerName, customerPhone, pickupAddress,
                specialInstructions, pickupAt, deliveryAt);
    }
}
