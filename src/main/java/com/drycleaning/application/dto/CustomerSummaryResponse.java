package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.Account;
import com.drycleaning.domain.entity.CustomerProfile;
import com.drycleaning.domain.entity.MembershipTier;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record CustomerSummaryResponse(
    Long customerId,
    String name,
    MembershipTier membershipTier,
    int loyaltyPoints,
    BigDecimal totalSpent,
    int totalOrders,
    LocalDateTime firstOrderAt,
    LocalDateTime lastOrderAt
) {

    public static CustomerSummaryResponse of(Account account, CustomerProfile profile, int loyaltyPoints) {
        return new CustomerSummaryResponse(
                account.getId(),
                account.getName(),
                profile.getMembershipTier(),
                loyaltyPoints,
                profile.getTotalSpent().getAmount(),
                profile.getTotalOrders(),
                profile.getFirstOrderAt(),
                profile.getLastOrderAt()
        );
    }
}
