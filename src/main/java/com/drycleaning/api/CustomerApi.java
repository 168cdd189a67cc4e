package com.drycleaning.api;

import com.drycleaning.application.dto.CustomerAnalyticsResponse;
import com.drycleaning.application.dto.CustomerSummaryResponse;
import com.drycleaning.application.dto.ShopCustomerStatsResponse;
import com.drycleaning.domain.entity.MembershipTier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Customer", description = "매장 고객 조회/분석 API (점주 전용)")
@RequestMapping("/api/shops/{shopId}/customers")
public interface CustomerApi {

    @Operation(summary = "매장 고객 목록 조회",
            description = "매장에 주문 이력이 있는 고객을 최근 주문 순으로 반환합니다. 이름/연락처/이메일 검색과 등급 필터를 지원합니다.")
    @GetMapping
    List<CustomerSummaryResponse> getShopCustomers(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "매장 ID", required = true, example = "1")
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @Parameter(description = "검색어", example = "홍길동")
            @RequestParam(required = false) @Size(max = 100, message = "검색어는 100자 이하여야 합니다") String search,
            @Parameter(description = "회원 등급", example = "GOLD")
            @RequestParam(required = false) MembershipTier tier
    );

    @Operation(summary = "매장 고객 통계",
            description = "등급 분포, 최근 30일 신규 고객, 최근 90일 활성 고객, 미사용 포인트 합계, 상위 고객")
    @GetMapping("/stats")
    ShopCustomerStatsResponse getShopCustomerStats(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId
    );

    @Operation(summary = "고객 분석", description = "이 매장의 완료 주문 기준 결제 금액, 평균 주문 금액, 선호 서비스/품목")
    @GetMapping("/{customerId}/analytics")
    CustomerAnalyticsResponse getCustomerAnalytics(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @Parameter(description = "고객 ID", required = true, example = "10")
            @PathVariable @Positive(message = "고객 ID는 양수여야 합니다") Long customerId
    );
}
