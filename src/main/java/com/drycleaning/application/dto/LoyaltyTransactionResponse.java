package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.LoyaltyTransaction;
import com.drycleaning.domain.entity.LoyaltyTransactionType;

import java.time.LocalDateTime;

public record LoyaltyTransactionResponse(
    Long id,
    LoyaltyTransactionType type,
    Integer points,
    Integer remainingPoints,
    String description,
    Long orderId,
    LocalDateTime expiresAt,
    LocalDateTime createdAt
) {

    public static LoyaltyTransactionResponse from(LoyaltyTransaction transaction) {
        return new LoyaltyTransactionResponse(
                transaction.getId(),
                transaction.getType(),
                transaction.getPoints(),
                transaction.getRemainingPoints(),
                transaction.getDescription(),
                transaction.getOrderId(),
                transaction.getExpiresAt(),
                transaction.getCreatedAt()
        );
    }
}
