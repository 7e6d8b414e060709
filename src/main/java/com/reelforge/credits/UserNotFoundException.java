package com.reelforge.credits;

import java.util.UUID;

public class UserNotFoundException extends CreditLedgerException {

    private final UUID accountId;

    public UserNotFoundException(UUID accountId) {
        super("Account not found: " + accountId);
        this.accountId = accountId;
    }

    public UUID getAccountId() {
        return accountId;
    }
}
