package com.drycleaning.application.service;

import com.drycleaning.application.access.AccessControl;
import com.drycleaning.application.access.Actor;
import com.drycleaning.application.dto.CustomerAddressRequest;
import com.drycleaning.application.dto.CustomerAddressResponse;
import com.drycleaning.domain.repository.CustomerAddressRepository;
import com.drycleaning.domain.service.CustomerAddressDomainService;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import com.drycleaning.infrastructure.lock.DistributedLockExecutor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 고객 주소록 Application Facade 서비스
 *
 * 고객 본인만 사용할 수 있으며, 변경은 고객 단위 분산 락 안에서 수행합니다.
 */
@Service
@RequiredArgsConstructor
public class CustomerAddressService {

    private static final String LOCK_KEY_PREFIX = "lock:address:";

    private final AccessControl accessControl;
    private final CustomerAddressRepository customerAddressRepository;
    private final CustomerAddressDomainService customerAddressDomainService;
    private final DistributedLockExecutor lockExecutor;
    private final Clock clock;

    public List<CustomerAddressResponse> getAddresses(Long accountId) {
        Actor actor = requireCustomer(accountId);
        return customerAddressRepository.findActiveByCustomerId(actor.accountId()).stream()
                .map(CustomerAddressResponse::from)
                .toList();
    }

    public CustomerAddressResponse createAddress(Long accountId, CustomerAddressRequest request) {
        Actor actor = requireCustomer(accountId);
        boolean makeDefault = Boolean.TRUE.equals(request.defaultAddress());
        return lockExecutor.executeWithLock(LOCK_KEY_PREFIX + actor.accountId(), () ->
                CustomerAddressResponse.from(customerAddressDomainService.create(
                        actor.accountId(), request.toDetails(), makeDefault, LocalDateTime.now(clock))));
    }

    public CustomerAddressResponse updateAddress(Long accountId, Long addressId, CustomerAddressRequest request) {
        Actor actor = requireCustomer(accountId);
        return lockExecutor.executeWithLock(LOCK_KEY_PREFIX + actor.accountId(), () ->
                CustomerAddressResponse.from(customerAddressDomainService.update(
                        actor.accountId(), addressId, request.toDetails(), request.defaultAddress(),
                        LocalDateTime.now(clock))));
    }

    public void deleteAddress(Long accountId, Long addressId) {
        Actor actor = requireCustomer(accountId);
        lockExecutor.executeWithLock(LOCK_KEY_PREFIX + actor.accountId(), () -> {
            customerAddressDomainService.deactivate(actor.accountId(), addressId, LocalDateTime.now(clock));
            return null;
        });
    }

    private Actor requireCustomer(Long accountId) {
        Actor actor = accessControl.resolve(accountId);
        if (!actor.isCustomer()) {
            throw new BusinessException(ErrorKind.FORBIDDEN, "고객 계정만 주소록을 사용할 수 있습니다");
        }
        return actor;
    }
}
