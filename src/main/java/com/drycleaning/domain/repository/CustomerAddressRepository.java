package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.CustomerAddress;

import java.util.List;
import java.util.Optional;

public interface CustomerAddressRepository {

    CustomerAddress save(CustomerAddress address);

    Optional<CustomerAddress> findById(Long id);

    /**
     * 활성 주소를 기본 주소 우선, 별칭 순으로 조회합니다.
     */
    List<CustomerAddress> findActiveByCustomerId(Long customerId);
}
