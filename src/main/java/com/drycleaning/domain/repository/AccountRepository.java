package com.drycleaning.domain.repository;

import com.drycleaning.domain.entity.Account;
import com.drycleaning.exception.BusinessException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface AccountRepository {

    Account save(Account account);

    Optional<Account> findById(Long id);

    default Account getByIdOrThrow(Long id) {
        return findById(id)
                .orElseThrow(() -> BusinessException.notFound("계정", id));
    }

    Optional<Account> findByPhone(String phone);

    List<Account> findAllById(Collection<Long> ids);
}
