package com.drycleaning.application.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 세탁 서비스/품목 등록·수정 요청
 * active가 없으면 활성 상태로 처리합니다.
 */
public record CatalogEntryRequest(
    @NotBlank(message = "이름은 필수입니다")
    @Size(max = 100, message = "이름은 100자 이하여야 합니다")
    String name,

    @Size(max = 1000, message = "설명은 1000자 이하여야 합니다")
    String description,

    Boolean active
) {

    public boolean isActiveOrDefault() {
        return active == null || active;
    }
}
