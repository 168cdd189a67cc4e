package com.drycleaning.interfaces.controller;

import com.drycleaning.api.AddressApi;
import com.drycleaning.application.dto.CustomerAddressRequest;
import com.drycleaning.application.dto.CustomerAddressResponse;
import com.drycleaning.application.service.CustomerAddressService;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequiredArgsConstructor
@Validated
public class AddressController implements AddressApi {

    private final CustomerAddressService customerAddressService;

    @Override
    public List<CustomerAddressResponse> getAddresses(Long accountId) {
        return customerAddressService.getAddresses(accountId);
    }

    @Override
    public CustomerAddressResponse createAddress(Long accountId, CustomerAddressRequest request) {
        return customerAddressService.createAddress(accountId, request);
    }

    @Override
    public CustomerAddressResponse updateAddress(Long accountId, Long addressId, CustomerAddressRequest request) {
        return customerAddressService.updateAddress(accountId, addressId, request);
    }

    @Override
    public void deleteAddress(Long accountId, Long addressId) {
        customerAddressService.deleteAddress(accountId, addressId);
    }
}
