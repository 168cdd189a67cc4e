package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.AddressDetails;
import com.drycleaning.domain.entity.AddressType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CustomerAddressRequest(
    AddressType type,

    @NotBlank(message = "주소 별칭은 필수입니다")
    @Size(max = 50, message = "주소 별칭은 50자 이하여야 합니다")
    String label,

    @NotBlank(message = "도로명 주소는 필수입니다")
    @Size(max = 255, message = "도로명 주소는 255자 이하여야 합니다")
    String streetAddress,

    @Size(max = 50, message = "상세 주소는 50자 이하여야 합니다")
    String apartmentUnit,

    @NotBlank(message = "도시는 필수입니다")
    @Size(max = 100, message = "도시는 100자 이하여야 합니다")
    String city,

    @NotBlank(message = "주/도는 필수입니다")
    @Size(max = 50, message = "주/도는 50자 이하여야 합니다")
    String state,

    @NotBlank(message = "우편번호는 필수입니다")
    @Size(max = 20, message = "우편번호는 20자 이하여야 합니다")
    String postalCode,

    @Size(max = 100, message = "국가는 100자 이하여야 합니다")
    String country,

    Boolean defaultAddress,

    @Size(max = 1000, message = "수거 요청사항은 1000자 이하여야 합니다")
    String pickupInstructions
) {

    public AddressDetails toDetails() {
        return new AddressDetails(type, label, streetAddress, apartmentUnit, city, state, postalCode, country,
                pickupInstructions);
    }
}
