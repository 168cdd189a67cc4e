package com.drycleaning.exception;

import com.drycleaning.dto.ErrorResponse;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;

/**
 * 전역 예외 처리 핸들러
 *
 * 모든 예외를 {error_kind, message, field_errors?} 형식의 ErrorResponse로 변환하여 반환합니다.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * BusinessException 처리
     * 도메인 규칙 위반은 warn 레벨로 남깁니다.
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        log.warn("BusinessException: kind={}, message={}", e.getErrorKind(), e.getErrorMessage());

        return ResponseEntity
                .status(e.getErrorKind().getHttpStatus())
                .body(ErrorResponse.of(e.getErrorKind(), e.getErrorMessage()));
    }

    /**
     * Validation 예외 처리
     * @Valid 검증 실패 시 필드별 오류를 함께 반환합니다.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        List<ErrorResponse.FieldError> fieldErrors = e.getBindingResult().getFieldErrors().stream()
                .map(error -> new ErrorResponse.FieldError(error.getField(), error.getDefaultMessage()))
                .toList();
        log.warn("ValidationException: fieldErrors={}", fieldErrors);

        return ResponseEntity
                .status(ErrorKind.VALIDATION_FAILED.getHttpStatus())
                .body(ErrorResponse.of(ErrorKind.VALIDATION_FAILED, ErrorKind.VALIDATION_FAILED.getMessage(), fieldErrors));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolationException(ConstraintViolationException e) {
        List<ErrorResponse.FieldError> fieldErrors = e.getConstraintViolations().stream()
                .map(violation -> new ErrorResponse.FieldError(
                        violation.getPropertyPath().toString(), violation.getMessage()))
                .toList();
        log.warn("ConstraintViolationException: fieldErrors={}", fieldErrors);

        return ResponseEntity
                .status(ErrorKind.VALIDATION_FAILED.getHttpStatus())
                .body(ErrorResponse.of(ErrorKind.VALIDATION_FAILED, ErrorKind.VALIDATION_FAILED.getMessage(), fieldErrors));
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        log.warn("BadRequest: type={}, message={}", e.getClass().getSimpleName(), e.getMessage());

        return ResponseEntity
                .status(ErrorKind.VALIDATION_FAILED.getHttpStatus())
                .body(ErrorResponse.of(ErrorKind.VALIDATION_FAILED, e.getMessage()));
    }

    /**
     * 저장소 예외 처리
     * 재시도 대상이 아닌 저장소 오류는 그대로 500으로 노출합니다.
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessException(DataAccessException e) {
        log.error("StorageFailure: ", e);

        return ResponseEntity
                .status(ErrorKind.STORAGE_FAILURE.getHttpStatus())
                .body(ErrorResponse.of(ErrorKind.STORAGE_FAILURE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("UnexpectedException: ", e);

        return ResponseEntity
                .status(ErrorKind.STORAGE_FAILURE.getHttpStatus())
                .body(ErrorResponse.of(ErrorKind.STORAGE_FAILURE, "서버 내부 오류가 발생했습니다."));
    }
}
