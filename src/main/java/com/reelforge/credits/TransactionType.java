package com.reelforge.credits;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reason codes recorded on every ledger entry.
 */
public enum TransactionType {
    PURCHASE("purchase"),
    SUBSCRIPTION("subscription"),
    GENERATION("generation"),
    REFUND("refund"),
    BONUS("bonus"),
    ADJUSTMENT("adjustment");

    /** Reasons a balance may be decreased for. */
    public static final Set<TransactionType> DEBIT_TYPES = EnumSet.of(GENERATION, ADJUSTMENT);

    /** Reasons a balance may be increased for. */
    public static final Set<TransactionType> CREDIT_TYPES = EnumSet.of(PURCHASE, SUBSCRIPTION, REFUND, BONUS,
            ADJUSTMENT);

    private final String code;

    TransactionType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static TransactionType fromCode(String code) {
        for (TransactionType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown transaction type: " + code);
    }
}
