package com.drycleaning.domain.service;

import com.drycleaning.domain.entity.AddressDetails;
import com.drycleaning.domain.entity.CustomerAddress;
import com.drycleaning.domain.repository.CustomerAddressRepository;
import com.drycleaning.exception.BusinessException;
import com.drycleaning.exception.ErrorKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 고객 주소록 도메인 서비스
 *
 * - 활성 주소 사이에서 별칭은 고객별로 유일합니다. (대소문자 무시)
 * - 기본 주소는 고객별로 최대 하나입니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerAddressDomainService {

    private final CustomerAddressRepository customerAddressRepository;

    @Transactional
    public CustomerAddress create(Long customerId, AddressDetails details, boolean makeDefault, LocalDateTime now) {
        List<CustomerAddress> active = customerAddressRepository.findActiveByCustomerId(customerId);
        requireUniqueLabel(active, details.label(), null);
        if (makeDefault) {
            clearDefaults(active, null, now);
        }

        CustomerAddress address = customerAddressRepository.save(
                new CustomerAddress(customerId, details, makeDefault, now));
        log.info("주소 등록: customerId={}, addressId={}, label={}", customerId, address.getId(), address.getLabel());
        return address;
    }

    /**
     * @param makeDefault null이면 기본 주소 여부를 유지합니다.
     */
    @Transactional
    public CustomerAddress update(Long customerId, Long addressId, AddressDetails details, Boolean makeDefault,
                                  LocalDateTime now) {
        CustomerAddress address = getActiveAddress(customerId, addressId);
        List<CustomerAddress> active = customerAddressRepository.findActiveByCustomerId(customerId);
        requireUniqueLabel(active, details.label(), addressId);

        address.update(details, now);
        if (Boolean.TRUE.equals(makeDefault)) {
            clearDefaults(active, addressId, now);
            address.markDefault(now);
        } else if (Boolean.FALSE.equals(makeDefault)) {
            address.clearDefault(now);
        }
        return customerAddressRepository.save(address);
    }

    @Transactional
    public void deactivate(Long customerId, Long addressId, LocalDateTime now) {
        CustomerAddress address = getActiveAddress(customerId, addressId);
        address.deactivate(now);
        customerAddressRepository.save(address);
        log.info("주소 비활성화: customerId={}, addressId={}", customerId, addressId);
    }

    /**
     * 다른 고객의 주소나 비활성 주소는 존재하지 않는 것으로 취급합니다.
     */
    private CustomerAddress getActiveAddress(Long customerId, Long addressId) {
        return customerAddressRepository.findById(addressId)
                .filter(a -> a.isOwnedBy(customerId) && a.isActive())
                .orElseThrow(() -> BusinessException.notFound("주소", addressId));
    }

    private void requireUniqueLabel(List<CustomerAddress> active, String label, Long excludeId) {
        if (label == null) {
            return;
        }
        boolean duplicated = active.stream()
                .filter(a -> !a.getId().equals(excludeId))
                .anyMatch(a -> a.hasLabel(label));
        if (duplicated) {
            throw new BusinessException(ErrorKind.DUPLICATE, "이미 사용 중인 주소 별칭입니다: " + label.trim());
        }
    }

    private void clearDefaults(List<CustomerAddress> active, Long exceptId, LocalDateTime now) {
        for (CustomerAddress other : active) {
            if (other.isDefaultAddress() && !other.getId().equals(exceptId)) {
                other.clearDefault(now);
                customerAddressRepository.save(other);
            }
        }
    }
}
