package com.drycleaning.application.access;

import com.drycleaning.domain.entity.AccountRole;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;

import java.util.Set;

/**
 * 요청 주체
 *
 * 권한은 소속 매장(shopId) 범위에서만 유효합니다. ADMIN은 모든 매장에 대해 모든 권한을 가집니다.
 */
public record Actor(Long accountId, AccountRole role, Long shopId, Set<Capability> capabilities) {

    public Actor {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean can(Capability capability, Long targetShopId) {
        if (role == AccountRole.ADMIN) {
            return true;
        }
        return shopId != null && shopId.equals(targetShopId) && capabilities.contains(capability);
    }

    public void require(Capability capability, Long targetShopId) {
        if (!can(capability, targetShopId)) {
            throw new BusinessException(ErrorKind.FORBIDDEN,
                    "권한이 없습니다: " + capability + " (shopId=" + targetShopId + ")");
        }
    }

    public boolean isCustomer() {
        return role == AccountRole.CUSTOMER;
    }

    public boolean isAdmin() {
        return role == AccountRole.ADMIN;
    }

    public boolean is(Long otherAccountId) {
        return accountId.equals(otherAccountId);
    }
}
