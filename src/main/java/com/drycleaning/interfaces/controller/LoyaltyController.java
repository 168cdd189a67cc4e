package com.drycleaning.interfaces.controller;

import com.drycleaning.api.LoyaltyApi;
import com.drycleaning.application.dto.*;
import com.drycleaning.application.service.LoyaltyService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Validated
public class LoyaltyController implements LoyaltyApi {

    private final LoyaltyService loyaltyService;

    @Override
    public PointBalanceResponse getBalance(Long accountId, Long customerId) {
        return loyaltyService.getBalance(accountId, customerId);
    }

    @Override
    public LoyaltyHistoryResponse getHistory(Long accountId, Long customerId, int page, int size) {
        return loyaltyService.getHistory(accountId, customerId, page, size);
    }

    @Override
    public CustomerSummaryResponse getSummary(Long accountId, Long customerId) {
        return loyaltyService.getSummary(accountId, customerId);
    }

    @Override
    public PointBalanceResponse redeem(Long accountId, Long customerId, PointRedeemRequest request) {
        return loyaltyService.redeem(accountId, customerId, request);
    }

    @Override
    public PointBalanceResponse grant(Long accountId, Long customerId, PointGrantRequest request) {
        return loyaltyService.grant(accountId, customerId, request);
    }
}
