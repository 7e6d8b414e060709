package com.reelforge.credits;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

public final class CreditColumnConverters {

    private CreditColumnConverters() {
    }

    @Converter
    public static class TierConverter implements AttributeConverter<SubscriptionTier, String> {
        @Override
        public String convertToDatabaseColumn(SubscriptionTier attribute) {
            return attribute == null ? null : attribute.getCode();
        }

        @Override
        public SubscriptionTier convertToEntityAttribute(String dbData) {
            return dbData == null ? SubscriptionTier.FREE : SubscriptionTier.fromCode(dbData);
        }
    }

    @Converter
    public static class TransactionTypeConverter implements AttributeConverter<TransactionType, String> {
        @Override
        public String convertToDatabaseColumn(TransactionType attribute) {
            return attribute == null ? null : attribute.getCode();
        }

        @Override
        public TransactionType convertToEntityAttribute(String dbData) {
            return dbData == null ? null : TransactionType.fromCode(dbData);
        }
    }
}
