package com.drycleaning.api;

import com.drycleaning.application.dto.*;
import com.drycleaning.domain.entity.OrderStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Order", description = "주문 API")
@RequestMapping("/api")
public interface OrderApi {

    @Operation(summary = "주문 생성",
            description = "매장에 주문을 생성합니다. 고객은 본인 주문만, 직원은 TAKE_ORDERS 권한으로 고객 대신 생성합니다.")
    @PostMapping("/shops/{shopId}/orders")
    @ResponseStatus(HttpStatus.CREATED)
    OrderCreateResponse createOrder(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "매장 ID", required = true, example = "1")
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @io.swagger.v3.oas.annotations.parameters.RequestBody(description = "주문 생성 요청", required = true)
            @RequestBody @Valid OrderCreateRequest request
    );

    @Operation(summary = "주문 상세 조회", description = "주문 항목과 상태 이력을 함께 조회합니다.")
    @GetMapping("/orders/{orderId}")
    OrderDetailResponse getOrder(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "주문 ID", required = true, example = "100")
            @PathVariable @Positive(message = "주문 ID는 양수여야 합니다") Long orderId
    );

    @Operation(summary = "내 주문 목록 조회")
    @GetMapping("/orders/me")
    List<OrderSummaryResponse> getMyOrders(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId
    );

    @Operation(summary = "매장 주문 목록 조회", description = "status로 필터링할 수 있습니다.")
    @GetMapping("/shops/{shopId}/orders")
    List<OrderSummaryResponse> getShopOrders(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "매장 ID", required = true, example = "1")
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @Parameter(description = "주문 상태", example = "RECEIVED")
            @RequestParam(required = false) OrderStatus status
    );

    @Operation(summary = "주문 상태 변경",
            description = "RECEIVED → IN_PROGRESS → READY_FOR_PICKUP → COMPLETED 순서이며, 완료 전에는 CANCELLED로 바꿀 수 있습니다.")
    @PatchMapping("/orders/{orderId}/status")
    OrderStatusResponse changeStatus(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "주문 ID", required = true, example = "100")
            @PathVariable @Positive(message = "주문 ID는 양수여야 합니다") Long orderId,
            @RequestBody @Valid OrderStatusChangeRequest request
    );

    @Operation(summary = "주문 항목 추가", description = "RECEIVED, IN_PROGRESS 상태에서만 가능합니다.")
    @PostMapping("/orders/{orderId}/items")
    OrderDetailResponse addItem(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "주문 ID", required = true, example = "100")
            @PathVariable @Positive(message = "주문 ID는 양수여야 합니다") Long orderId,
            @RequestBody @Valid OrderItemAddRequest request
    );

    @Operation(summary = "주문 항목 삭제", description = "마지막 항목은 삭제할 수 없습니다.")
    @DeleteMapping("/orders/{orderId}/items/{orderItemId}")
    OrderDetailResponse removeItem(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "주문 ID", required = true, example = "100")
            @PathVariable @Positive(message = "주문 ID는 양수여야 합니다") Long orderId,
            @Parameter(description = "주문 항목 ID", required = true, example = "1000")
            @PathVariable @Positive(message = "주문 항목 ID는 양수여야 합니다") Long orderItemId
    );

    @Operation(summary = "취소 주문 삭제", description = "점주 또는 관리자만 취소된 주문을 삭제할 수 있습니다.")
    @DeleteMapping("/orders/{orderId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    void deleteOrder(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "주문 ID", required = true, example = "100")
            @PathVariable @Positive(message = "주문 ID는 양수여야 합니다") Long orderId
    );
}
