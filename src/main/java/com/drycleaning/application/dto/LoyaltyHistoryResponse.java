package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.LoyaltyTransaction;
import org.springframework.data.domain.Page;

import java.util.List;

public record LoyaltyHistoryResponse(
    Long customerId,
    List<LoyaltyTransactionResponse> transactions,
    int page,
    int size,
    long totalElements
) {

    public static LoyaltyHistoryResponse of(Long customerId, Page<LoyaltyTransaction> page) {
        return new LoyaltyHistoryResponse(
                customerId,
                page.getContent().stream().map(LoyaltyTransactionResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements()
        );
    }
}
