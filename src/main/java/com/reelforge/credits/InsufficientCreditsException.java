package com.reelforge.credits;

import java.util.UUID;

public class InsufficientCreditsException extends CreditLedgerException {

    private final UUID accountId;
    private final int available;
    private final int requested;

    public InsufficientCreditsException(UUID accountId, int available, int requested) {
        super("Insufficient credits for account " + accountId + ": requested " + requested + ", available "
                + available);
        this.accountId = accountId;
        this.available = available;
        this.requested = requested;
    }

    public UUID getAccountId() {
        return accountId;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequested() {
        return requested;
    }
}
