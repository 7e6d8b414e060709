package com.reelforge.credits;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CreditColumnConvertersTest {

    @Test
    void shouldRoundTripStoredCodes() {
        CreditColumnConverters.TierConverter tiers = new CreditColumnConverters.TierConverter();
        CreditColumnConverters.TransactionTypeConverter types = new CreditColumnConverters.TransactionTypeConverter();

        assertEquals("enterprise", tiers.convertToDatabaseColumn(SubscriptionTier.ENTERPRISE));
        assertEquals(SubscriptionTier.PRO, tiers.convertToEntityAttribute("pro"));
        assertEquals("refund", types.convertToDatabaseColumn(TransactionType.REFUND));
        assertEquals(TransactionType.ADJUSTMENT, types.convertToEntityAttribute("adjustment"));
        assertThrows(IllegalArgumentException.class, () -> types.convertToEntityAttribute("chargeback"));
    }

    @Test
    void shouldRestrictTransactionTypesByDirection() {
        assertTrue(TransactionType.DEBIT_TYPES.contains(TransactionType.ADJUSTMENT));
        assertTrue(TransactionType.CREDIT_TYPES.contains(TransactionType.ADJUSTMENT));
        assertFalse(TransactionType.CREDIT_TYPES.contains(TransactionType.GENERATION));
        assertFalse(TransactionType.DEBIT_TYPES.contains(TransactionType.REFUND));
    }
}
