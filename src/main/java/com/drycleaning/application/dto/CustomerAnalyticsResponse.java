package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.MembershipTier;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 매장 기준 고객 분석
 * 금액/건수/주문일은 해당 매장의 완료 주문만 집계합니다.
 */
public record CustomerAnalyticsResponse(
    Long customerId,
    String name,
    MembershipTier membershipTier,
    BigDecimal totalSpent,
    int completedOrders,
    BigDecimal averageOrderValue,
    int loyaltyPoints,
    LocalDateTime firstOrderAt,
    LocalDateTime lastOrderAt,
    Long daysSinceLastOrder,
    List<UsageCount> preferredServices,
    List<UsageCount> preferredItems
) {

    public record UsageCount(String name, int quantity) {
    }
}
