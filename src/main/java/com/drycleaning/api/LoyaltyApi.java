package com.drycleaning.api;

import com.drycleaning.application.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.web.bind.annotation.*;

@Tag(name = "Loyalty", description = "고객 포인트 API")
@RequestMapping("/api/customers/{customerId}")
public interface LoyaltyApi {

    @Operation(summary = "포인트 잔액 조회", description = "만료되지 않은 적립분의 잔량 합계를 반환합니다.")
    @GetMapping("/points")
    PointBalanceResponse getBalance(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "고객 ID", required = true, example = "1")
            @PathVariable @Positive(message = "고객 ID는 양수여야 합니다") Long customerId
    );

    @Operation(summary = "포인트 거래 내역 조회", description = "최신 거래부터 페이지 단위로 조회합니다.")
    @GetMapping("/points/history")
    LoyaltyHistoryResponse getHistory(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "고객 ID는 양수여야 합니다") Long customerId,
            @Parameter(description = "페이지 (0부터)", example = "0") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "페이지 크기", example = "20") @RequestParam(defaultValue = "20") int size
    );

    @Operation(summary = "고객 요약 조회", description = "등급, 누적 결제 금액, 주문 수, 포인트 잔액")
    @GetMapping("/summary")
    CustomerSummaryResponse getSummary(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "고객 ID는 양수여야 합니다") Long customerId
    );

    @Operation(summary = "포인트 사용", description = "만료일이 빠른 적립분부터 차감합니다.")
    @PostMapping("/points/redeem")
    PointBalanceResponse redeem(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "고객 ID는 양수여야 합니다") Long customerId,
            @RequestBody @Valid PointRedeemRequest request
    );

    @Operation(summary = "보너스 지급 / 수동 조정", description = "점주 또는 관리자만 사용할 수 있습니다.")
    @PostMapping("/points/grant")
    PointBalanceResponse grant(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "고객 ID는 양수여야 합니다") Long customerId,
            @RequestBody @Valid PointGrantRequest request
    );
}
