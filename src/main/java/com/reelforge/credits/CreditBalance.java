package com.reelforge.credits;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Read-only view of an account's credit state.
 */
public record CreditBalance(
        UUID accountId,
        int creditsRemaining,
        SubscriptionTier subscriptionTier,
        OffsetDateTime subscriptionExpiresAt,
        long lifetimeCreditsUsed) {

    static CreditBalance of(AccountCredits account) {
        return new CreditBalance(account.getId(), account.getCreditsRemaining(), account.getSubscriptionTier(),
                account.getSubscriptionExpiresAt(), account.getLifetimeCreditsUsed());
    }

    /**
     * A paid tier is active until its expiry; a missing expiry never lapses.
     */
    public boolean isSubscriptionActive(OffsetDateTime now) {
        if (subscriptionTier == SubscriptionTier.FREE) {
            return false;
        }
        return subscriptionExpiresAt == null || subscriptionExpiresAt.isAfter(now);
    }

    /**
     * The tier to gate features on: lapsed paid tiers read as {@code FREE}.
     */
    public SubscriptionTier effectiveTier(OffsetDateTime now) {
        return isSubscriptionActive(now) ? subscriptionTier : SubscriptionTier.FREE;
    }

    public boolean canAfford(int cost) {
        return cost > 0 && creditsRemaining >= cost;
    }
}
