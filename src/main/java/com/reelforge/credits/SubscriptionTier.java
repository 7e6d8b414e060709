package com.reelforge.credits;

public enum SubscriptionTier {
    FREE("free"),
    PRO("pro"),
    ENTERPRISE("enterprise");

    private final String code;

    SubscriptionTier(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static SubscriptionTier fromCode(String code) {
        for (SubscriptionTier tier : values()) {
            if (tier.code.equalsIgnoreCase(code)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown subscription tier: " + code);
    }
}
