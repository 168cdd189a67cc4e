package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.CustomerAddress;
import com.drycleaning.domain.repository.CustomerAddressRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class CustomerAddressRepositoryImpl implements CustomerAddressRepository {

    private final JpaCustomerAddressRepository jpaCustomerAddressRepository;

    @Override
    public CustomerAddress save(CustomerAddress address) {
        return jpaCustomerAddressRepository.save(address);
    }

    @Override
    public Optional<CustomerAddress> findById(Long id) {
        return jpaCustomerAddressRepository.findById(id);
    }

    @Override
    public List<CustomerAddress> findActiveByCustomerId(Long customerId) {
        return jpaCustomerAddressRepository.findByCustomerIdAndActiveTrueOrderByDefaultAddressDescLabelAsc(customerId);
    }
}
