package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.AddressType;
import com.drycleaning.domain.entity.CustomerAddress;

public record CustomerAddressResponse(
    Long addressId,
    AddressType type,
    String label,
    String streetAddress,
    String apartmentUnit,
    String city,
    String state,
    String postalCode,
    String country,
    boolean defaultAddress,
    String pickupInstructions,
    String fullAddress
) {

    public static CustomerAddressResponse from(CustomerAddress address) {
        return new CustomerAddressResponse(
                address.getId(),
                address.getType(),
                address.getLabel(),
                address.getStreetAddress(),
                address.getApartmentUnit(),
                address.getCity(),
                address.getState(),
                address.getPostalCode(),
                address.getCountry(),
                address.isDefaultAddress(),
                address.getPickupInstructions(),
                address.getFullAddress()
        );
    }
}
