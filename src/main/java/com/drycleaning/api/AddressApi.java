package com.drycleaning.api;

import com.drycleaning.application.dto.CustomerAddressRequest;
import com.drycleaning.application.dto.CustomerAddressResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Address", description = "고객 주소록 API")
@RequestMapping("/api/customers/me/addresses")
public interface AddressApi {

    @Operation(summary = "주소 목록 조회", description = "기본 주소가 먼저, 나머지는 별칭 순으로 반환합니다.")
    @GetMapping
    List<CustomerAddressResponse> getAddresses(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId
    );

    @Operation(summary = "주소 등록", description = "defaultAddress가 true이면 기존 기본 주소는 해제됩니다.")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    CustomerAddressResponse createAddress(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @RequestBody @Valid CustomerAddressRequest request
    );

    @Operation(summary = "주소 수정")
    @PutMapping("/{addressId}")
    CustomerAddressResponse updateAddress(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @Parameter(description = "주소 ID", required = true, example = "1")
            @PathVariable @Positive(message = "주소 ID는 양수여야 합니다") Long addressId,
            @RequestBody @Valid CustomerAddressRequest request
    );

    @Operation(summary = "주소 삭제", description = "주소를 비활성화합니다.")
    @DeleteMapping("/{addressId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    void deleteAddress(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "주소 ID는 양수여야 합니다") Long addressId
    );
}
