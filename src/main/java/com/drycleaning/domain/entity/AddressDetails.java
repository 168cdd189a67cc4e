package com.drycleaning.domain.entity;

/**
 * 고객 주소 입력값
 */
public record AddressDetails(
        AddressType type,
        String label,
        String streetAddress,
        String apartmentUnit,
        String city,
        String state,
        String postalCode,
        String country,
        String pickupInstructions
) {
}
