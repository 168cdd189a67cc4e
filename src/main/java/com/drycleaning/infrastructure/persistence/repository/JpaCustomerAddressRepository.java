package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.CustomerAddress;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface JpaCustomerAddressRepository extends JpaRepository<CustomerAddress, Long> {
    List<CustomerAddress> findByCustomerIdAndActiveTrueOrderByDefaultAddressDescLabelAsc(Long customerId);
}
