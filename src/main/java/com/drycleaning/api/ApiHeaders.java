package com.drycleaning.api;

public final class ApiHeaders {

    /**
     * 요청 계정 ID. 인증 계층이 채워 주는 값을 대신합니다.
     */
    public static final String ACCOUNT_ID = "X-Account-Id";

    private ApiHeaders() {
    }
}
