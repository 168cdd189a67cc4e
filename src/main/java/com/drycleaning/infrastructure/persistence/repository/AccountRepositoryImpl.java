package com.drycleaning.infrastructure.persistence.repository;

import com.drycleaning.domain.entity.Account;
import com.drycleaning.domain.repository.AccountRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class AccountRepositoryImpl implements AccountRepository {

    private final JpaAccountRepository jpaAccountRepository;

    @Override
    public Account save(Account account) {
        return jpaAccountRepository.save(account);
    }

    @Override
    public Optional<Account> findById(Long id) {
        return jpaAccountRepository.findById(id);
    }

    @Override
    public Optional<Account> findByPhone(String phone) {
        return jpaAccountRepository.findByPhone(phone);
    }

    @Override
    public List<Account> findAllById(Collection<Long> ids) {
        return jpaAccountRepository.findAllById(ids);
    }
}
