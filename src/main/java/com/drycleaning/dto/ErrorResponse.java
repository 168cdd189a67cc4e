package com.drycleaning.dto;

import com.drycleaning.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "공통 에러 응답")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        @Schema(description = "에러 종류", example = "INVALID_TRANSITION")
        @JsonProperty("error_kind")
        String errorKind,

        @Schema(description = "메시지", example = "허용되지 않은 주문 상태 변경입니다.")
        String message,

        @Schema(description = "필드 검증 오류 목록")
        @JsonProperty("field_errors")
        List<FieldError> fieldErrors
) {

    public record FieldError(String field, String message) {
    }

    public static ErrorResponse of(ErrorKind errorKind) {
        return new ErrorResponse(errorKind.name(), errorKind.getMessage(), null);
    }

    public static ErrorResponse of(ErrorKind errorKind, String customMessage) {
        return new ErrorResponse(errorKind.name(), customMessage, null);
    }

    public static ErrorResponse of(ErrorKind errorKind, String customMessage, List<FieldError> fieldErrors) {
        return new ErrorResponse(errorKind.name(), customMessage, fieldErrors);
    }
}
