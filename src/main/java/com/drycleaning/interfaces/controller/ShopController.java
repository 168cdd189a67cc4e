package com.drycleaning.interfaces.controller;

import com.drycleaning.api.ShopApi;
import com.drycleaning.application.dto.*;
import com.drycleaning.application.service.ShopService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Validated
public class ShopController implements ShopApi {

    private final ShopService shopService;

    @Override
    public AccountResponse registerCustomer(Long accountId, Long shopId, CustomerRegisterRequest request) {
        return shopService.registerCustomer(accountId, shopId, request);
    }

    @Override
    public List<StaffResponse> getStaff(Long accountId, Long shopId) {
        return shopService.getStaff(accountId, shopId);
    }

    @Override
    public StaffResponse registerStaff(Long accountId, Long shopId, StaffRegisterRequest request) {
        return shopService.registerStaff(accountId, shopId, request);
    }

    @Override
    public StaffResponse updateStaff(Long accountId, Long shopId, Long staffId, StaffPermissionRequest request) {
        return shopService.updateStaff(accountId, shopId, staffId, request);
    }
}
