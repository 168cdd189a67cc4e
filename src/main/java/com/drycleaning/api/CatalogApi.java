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

@Tag(name = "Catalog", description = "매장 카탈로그 API")
@RequestMapping("/api/shops/{shopId}")
public interface CatalogApi {

    @Operation(summary = "가격표 조회", description = "주문 가능한 품목/서비스 가격 목록을 조회합니다.")
    @GetMapping("/catalog")
    CatalogResponse getCatalog(
            @Parameter(description = "매장 ID", required = true, example = "1")
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId
    );

    @Operation(summary = "세탁 서비스 목록 조회", description = "비활성 서비스도 포함합니다.")
    @GetMapping("/services")
    List<CatalogEntryResponse> getServices(
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId
    );

    @Operation(summary = "세탁 서비스 등록")
    @PostMapping("/services")
    @ResponseStatus(HttpStatus.CREATED)
    CatalogEntryResponse createService(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @RequestBody @Valid CatalogEntryRequest request
    );

    @Operation(summary = "세탁 서비스 수정")
    @PutMapping("/services/{serviceId}")
    CatalogEntryResponse updateService(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @PathVariable @Positive(message = "서비스 ID는 양수여야 합니다") Long serviceId,
            @RequestBody @Valid CatalogEntryRequest request
    );

    @Operation(summary = "품목 목록 조회", description = "비활성 품목도 포함합니다.")
    @GetMapping("/items")
    List<CatalogEntryResponse> getItems(
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId
    );

    @Operation(summary = "품목 등록")
    @PostMapping("/items")
    @ResponseStatus(HttpStatus.CREATED)
    CatalogEntryResponse createItem(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @RequestBody @Valid CatalogEntryRequest request
    );

    @Operation(summary = "품목 수정")
    @PutMapping("/items/{itemId}")
    CatalogEntryResponse updateItem(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @PathVariable @Positive(message = "품목 ID는 양수여야 합니다") Long itemId,
            @RequestBody @Valid CatalogEntryRequest request
    );

    @Operation(summary = "서비스 가격 등록", description = "(품목, 서비스) 조합마다 하나의 가격만 등록할 수 있습니다.")
    @PostMapping("/prices")
    @ResponseStatus(HttpStatus.CREATED)
    ServicePriceResponse createPrice(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @RequestBody @Valid ServicePriceRequest request
    );

    @Operation(summary = "서비스 가격 수정", description = "이미 생성된 주문 항목의 단가는 바뀌지 않습니다.")
    @PutMapping("/prices/{priceId}")
    ServicePriceResponse updatePrice(
            @Parameter(hidden = true) @RequestHeader(ApiHeaders.ACCOUNT_ID) Long accountId,
            @PathVariable @Positive(message = "매장 ID는 양수여야 합니다") Long shopId,
            @PathVariable @Positive(message = "가격 ID는 양수여야 합니다") Long priceId,
            @RequestBody @Valid ServicePriceUpdateRequest request
    );
}
