package com.drycleaning.application.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CustomerRegisterRequest(
    @NotBlank(message = "이름은 필수입니다")
    @Size(max = 100, message = "이름은 100자 이하여야 합니다")
    String name,

    @NotBlank(message = "연락처는 필수입니다")
    @Pattern(regexp = "^[0-9+\\-]{8,20}$", message = "연락처 형식이 올바르지 않습니다")
    String phone,

    @Email(message = "이메일 형식이 올바르지 않습니다")
    String email
) {}
