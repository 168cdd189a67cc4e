package com.drycleaning.application.service;

import com.drycleaning.application.access.AccessControl;
import com.drycleaning.application.access.Capability;
import com.drycleaning.application.dto.*;
import com.drycleaning.domain.entity.Account;
import com.drycleaning.domain.entity.AccountRole;
import com.drycleaning.domain.entity.CustomerProfile;
import com.drycleaning.domain.entity.ShopStaff;
import com.drycleaning.domain.repository.AccountRepository;
import com.drycleaning.domain.repository.CustomerProfileRepository;
import com.drycleaning.domain.repository.ShopRepository;
import com.drycleaning.domain.repository.ShopStaffRepository;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 매장 디렉터리 서비스
 *
 * - 고객 등록: REGISTER_CUSTOMERS 권한
 * - 직원 등록/권한 변경/조회: MANAGE_STAFF 권한 (점주)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShopService {

    private final AccessControl accessControl;
    private final ShopRepository shopRepository;
    private final ShopStaffRepository shopStaffRepository;
    private final AccountRepository accountRepository;
    private final CustomerProfileRepository customerProfileRepository;
    private final Clock clock;

    @Transactional
    public AccountResponse registerCustomer(Long accountId, Long shopId, CustomerRegisterRequest request) {
        accessControl.resolve(accountId).require(Capability.REGISTER_CUSTOMERS, shopId);
        shopRepository.getByIdOrThrow(shopId);
        requireUniquePhone(request.phone());

        LocalDateTime now = LocalDateTime.now(clock);
        Account customer = accountRepository.save(
                new Account(request.name(), request.phone(), request.email(), AccountRole.CUSTOMER, now));
        customerProfileRepository.save(new CustomerProfile(customer.getId(), now));

        log.info("고객 등록: shopId={}, customerId={}, registeredBy={}", shopId, customer.getId(), accountId);
        return AccountResponse.from(customer);
    }

    @Transactional
    public StaffResponse registerStaff(Long accountId, Long shopId, StaffRegisterRequest request) {
        accessControl.resolve(accountId).require(Capability.MANAGE_STAFF, shopId);
        shopRepository.getByIdOrThrow(shopId);
        requireUniquePhone(request.phone());

        LocalDateTime now = LocalDateTime.now(clock);
        Account account = accountRepository.save(
                new Account(request.name(), request.phone(), request.email(), AccountRole.STAFF, now));
        ShopStaff staff = shopStaffRepository.save(new ShopStaff(shopId, account.getId(), request.position(),
                request.canTakeOrders(), request.canUpdateOrders(), request.canRegisterCustomers(), now));

        log.info("직원 등록: shopId={}, staffId={}, accountId={}", shopId, staff.getId(), account.getId());
        return StaffResponse.from(staff);
    }

    @Transactional
    public StaffResponse updateStaff(Long accountId, Long shopId, Long staffId, StaffPermissionRequest request) {
        accessControl.resolve(accountId).require(Capability.MANAGE_STAFF, shopId);
        ShopStaff staff = shopStaffRepository.findById(staffId)
                .filter(s -> s.getShopId().equals(shopId))
                .orElseThrow(() -> BusinessException.notFound("직원", staffId));

        LocalDateTime now = LocalDateTime.now(clock);
        staff.updatePermissions(request.canTakeOrders(), request.canUpdateOrders(), request.canRegisterCustomers(), now);
        if (request.active()) {
            staff.activate(now);
        } else {
            staff.deactivate(now);
        }
        return StaffResponse.from(shopStaffRepository.save(staff));
    }

    public List<StaffResponse> getStaff(Long accountId, Long shopId) {
        accessControl.resolve(accountId).require(Capability.MANAGE_STAFF, shopId);
        return shopStaffRepository.findByShopId(shopId).stream()
                .map(StaffResponse::from)
                .toList();
    }

    private void requireUniquePhone(String phone) {
        if (accountRepository.findByPhone(phone).isPresent()) {
            throw new BusinessException(ErrorKind.DUPLICATE, "이미 등록된 연락처입니다: " + phone);
        }
    }
}
