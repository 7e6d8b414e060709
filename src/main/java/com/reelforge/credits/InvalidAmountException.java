package com.reelforge.credits;

public class InvalidAmountException extends CreditLedgerException {

    private final long amount;

    public InvalidAmountException(long amount) {
        super("Credit amount must be a positive integer, got " + amount);
        this.amount = amount;
    }

    public InvalidAmountException(long amount, String message, Throwable cause) {
        super(message, cause);
        this.amount = amount;
    }

    public long getAmount() {
        return amount;
    }
}
