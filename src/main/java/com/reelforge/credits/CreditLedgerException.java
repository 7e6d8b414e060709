package com.reelforge.credits;

/**
 * Base type of ledger rejections. A rejected call has no side effect: no
 * balance change and no transaction row.
 */
public abstract class CreditLedgerException extends RuntimeException {

    protected CreditLedgerException(String message) {
        super(message);
    }

    protected CreditLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
