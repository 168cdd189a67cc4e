package com.drycleaning.api;

import com.drycleaning.application.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Tag(name = "Shop", description = "매장 고객/직원 관리 API")
@RequestMapping("/api/shops/{shopId}")
public interface ShopApi {

    @Operation(summary = "고객 등록", description = "REGISTER_CUSTOMERS 권한이 필요합니다.")
    @PostMapping("/customers")
    @ResponseStatus(HttpStatus.CREATED)
    AccountResponse registerCustomer(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @RequestBody @Valid CustomerRegisterRequest request
    );

    @Operation(summary = "직원 목록 조회")
    @GetMapping("/staff")
    List<StaffResponse> getStaff(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId
    );

    @Operation(summary = "직원 등록", description = "점주 또는 관리자만 등록할 수 있습니다.")
    @PostMapping("/staff")
    @ResponseStatus(HttpStatus.CREATED)
    StaffResponse registerStaff(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @RequestBody @Valid StaffRegisterRequest request
    );

    @Operation(summary = "직원 권한 변경", description = "권한 플래그와 재직 여부를 변경합니다.")
    @PatchMapping("/staff/{staffId}")
    StaffResponse updateStaff(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @PathVariable @Positive(message = "직원 ID는 양수여야 합니다") Long staffId,
            @RequestBody StaffPermissionRequest request
    );
}
