package com.drycleaning.application.access;

/**
 * 계정을 역할과 매장 단위 권한 집합으로 해석합니다.
 */
public interface AccessControl {

    /**
     * @throws com.drycleaning.exception.BusinessException FORBIDDEN - 존재하지 않는 계정
     */
    Actor resolve(Long accountId);
}
