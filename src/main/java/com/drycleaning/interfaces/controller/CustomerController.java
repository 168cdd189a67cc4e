package com.drycleaning.interfaces.controller;

import com.drycleaning.api.CustomerApi;
import com.drycleaning.application.dto.CustomerAnalyticsResponse;
import com.drycleaning.application.dto.CustomerSummaryResponse;
import com.drycleaning.application.dto.ShopCustomerStatsResponse;
import com.drycleaning.application.service.CustomerService;
import com.drycleaning.domain.entity.MembershipTier;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Validated
public class CustomerController implements CustomerApi {

    private final CustomerService customerService;

    @Override
    public List<CustomerSummaryResponse> getShopCustomers(Long accountId, Long shopId, String search,
                                                          MembershipTier tier) {
        return customerService.getShopCustomers(accountId, shopId, search, tier);
    }

    @Override
    public ShopCustomerStatsResponse getShopCustomerStats(Long accountId, Long shopId) {
        return customerService.getShopCustomerStats(accountId, shopId);
    }

    @Override
    public CustomerAnalyticsResponse getCustomerAnalytics(Long accountId, Long shopId, Long customerId) {
        return customerService.getCustomerAnalytics(accountId, shopId, customerId);
    }
}
