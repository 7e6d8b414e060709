package com.reelforge.credits;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Result of an applied debit or credit.
 *
 * @param amount       signed amount recorded in the ledger
 * @param balanceAfter account balance once the entry was applied
 */
public record CreditReceipt(
        UUID transactionId,
        UUID accountId,
        int amount,
        TransactionType transactionType,
        int balanceAfter,
        String referenceId,
        OffsetDateTime createdAt) {

    static CreditReceipt of(CreditTransaction transaction) {
        return new CreditReceipt(transaction.getId(), transaction.getAccountId(), transaction.getAmount(),
                transaction.getTransactionType(), transaction.getBalanceAfter(), transaction.getReferenceId(),
                transaction.getCreatedAt());
    }
}
