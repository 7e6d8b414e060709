package com.reelforge.credits;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * The balance columns of an account row. The rest of the account record
 * belongs to the application; these columns are written only by
 * {@link CreditLedger}.
 */
@Entity
@Table(name = "users")
public class AccountCredits {

    @Id
    private UUID id;

    @Column(name = "credits_remaining", nullable = false)
    private int creditsRemaining;

    @Convert(converter = CreditColumnConverters.TierConverter.class)
    @Column(name = "subscription_tier", nullable = false, length = 20)
    private SubscriptionTier subscriptionTier = SubscriptionTier.FREE;

    @Column(name = "subscription_expires_at")
    private OffsetDateTime subscriptionExpiresAt;

    @Column(name = "lifetime_credits_used", nullable = false)
    private long lifetimeCreditsUsed;

    @Column(name = "external_subscription_ref")
    private String externalSubscriptionRef;

    protected AccountCredits() {
    }

    AccountCredits(UUID id, int creditsRemaining) {
        this.id = id;
        this.creditsRemaining = creditsRemaining;
    }

    void applyDebit(int amount) {
        this.creditsRemaining -= amount;
        this.lifetimeCreditsUsed = Math.addExact(this.lifetimeCreditsUsed, (long) amount);
    }

    void applyCredit(int amount) {
        this.creditsRemaining = Math.addExact(this.creditsRemaining, amount);
    }

    void applySubscription(SubscriptionTier tier, OffsetDateTime expiresAt, String externalSubscriptionRef) {
        this.subscriptionTier = tier;
        this.subscriptionExpiresAt = expiresAt;
        if (externalSubscriptionRef != null) {
            this.externalSubscriptionRef = externalSubscriptionRef;
        }
    }

    public UUID getId() {
        return id;
    }

    public int getCreditsRemaining() {
        return creditsRemaining;
    }

    public SubscriptionTier getSubscriptionTier() {
        return subscriptionTier;
    }

    public OffsetDateTime getSubscriptionExpiresAt() {
        return subscriptionExpiresAt;
    }

    public long getLifetimeCreditsUsed() {
        return lifetimeCreditsUsed;
    }

    public String getExternalSubscriptionRef() {
        return externalSubscriptionRef;
    }
}
