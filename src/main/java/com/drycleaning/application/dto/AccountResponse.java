package com.drycleaning.application.dto;

import com.drycleaning.domain.entity.Account;
import com.drycleaning.domain.entity.AccountRole;

public record AccountResponse(
    Long accountId,
    String name,
    String phone,
    String email,
    AccountRole role
) {

    public static AccountResponse from(Account account) {
        return new AccountResponse(account.getId(), account.getName(), account.getPhone(),
                account.getEmail(), account.getRole());
    }
}
