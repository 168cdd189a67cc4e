package com.drycleaning.application.access;

import com.drycleaning.domain.entity.Account;
import com.drycleaning.domain.entity.AccountRole;
import com.drycleaning.domain.entity.Shop;
import com.drycleaning.domain.entity.ShopStaff;
import com.drycleaning.domain.repository.AccountRepository;
import com.drycleaning.domain.repository.ShopRepository;
import com.drycleaning.domain.repository.ShopStaffRepository;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 매장/직원 정보 기반 AccessControl 구현체
 *
 * - SHOP_OWNER: 소유 매장에 대한 모든 권한
 * - STAFF: 활성 상태일 때 매장 주문 조회 + 직원별 권한 플래그
 * - CUSTOMER: 매장 권한 없음 (본인 주문/포인트만 접근)
 * - ADMIN: 전체 권한
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ShopAccessControl implements AccessControl {

    private final AccountRepository accountRepository;
    private final ShopRepository shopRepository;
    private final ShopStaffRepository shopStaffRepository;

    @Override
    @Transactional(readOnly = true)
    public Actor resolve(Long accountId) {
        if (accountId == null) {
            throw new BusinessException(ErrorKind.FORBIDDEN, "요청 계정이 없습니다");
        }
        Account account = accountRepository.findById(accountId)
                .orElseThrow(() -> {
                    log.warn("알 수 없는 계정 요청: accountId={}", accountId);
                    return new BusinessException(ErrorKind.FORBIDDEN, "알 수 없는 계정입니다: " + accountId);
                });

        return switch (account.getRole()) {
            case ADMIN -> new Actor(accountId, AccountRole.ADMIN, null, EnumSet.allOf(Capability.class));
            case SHOP_OWNER -> resolveOwner(accountId);
            case STAFF -> resolveStaff(accountId);
            case CUSTOMER -> new Actor(accountId, AccountRole.CUSTOMER, null, Set.of());
        };
    }

    private Actor resolveOwner(Long accountId) {
        Optional<Shop> shop = shopRepository.findByOwnerId(accountId);
        if (shop.isEmpty() || !shop.get().isActive()) {
            return new Actor(accountId, AccountRole.SHOP_OWNER, null, Set.of());
        }
        return new Actor(accountId, AccountRole.SHOP_OWNER, shop.get().getId(), EnumSet.allOf(Capability.class));
    }

    private Actor resolveStaff(Long accountId) {
        Optional<ShopStaff> staff = shopStaffRepository.findByAccountId(accountId)
                .filter(ShopStaff::isActive);
        if (staff.isEmpty()) {
            return new Actor(accountId, AccountRole.STAFF, null, Set.of());
        }

        ShopStaff member = staff.get();
        Set<Capability> capabilities = EnumSet.of(Capability.VIEW_SHOP_ORDERS);
        if (member.isCanTakeOrders()) {
            capabilities.add(Capability.TAKE_ORDERS);
        }
        if (member.isCanUpdateOrders()) {
            capabilities.add(Capability.UPDATE_ORDERS);
        }
        if (member.isCanRegisterCustomers()) {
            capabilities.add(Capability.REGISTER_CUSTOMERS);
        }
        return new Actor(accountId, AccountRole.STAFF, member.getShopId(), capabilities);
    }
}
