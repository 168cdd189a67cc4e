package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.MembershipTier;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

public record ShopCustomerStatsResponse(
    int totalCustomers,
    Map<MembershipTier, Long> tierDistribution,
    long newCustomers,
    long activeCustomers,
    long totalLoyaltyPointsOutstanding,
    BigDecimal averageCustomerValue,
    List<CustomerSummaryResponse> topSpenders,
    List<CustomerSummaryResponse> mostLoyal
) {}
