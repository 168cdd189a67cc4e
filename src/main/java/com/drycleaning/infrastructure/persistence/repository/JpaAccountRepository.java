package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.Account;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface JpaAccountRepository extends JpaRepository<Account, Long> {
    Optional<Account> findByPhone(String phone);
}
