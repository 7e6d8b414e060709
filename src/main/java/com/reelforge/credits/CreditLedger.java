package com.reelforge.credits;

import com.reelforge.config.ReelForgeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Metered credit balances. Every mutation locks the account row, checks,
 * writes the new balance and appends a {@link CreditTransaction} in a single
 * database transaction, so concurrent debits serialize on the row and a
 * rejected call leaves nothing behind.
 */
@Service
public class CreditLedger {

    private static final Logger log = LoggerFactory.getLogger(CreditLedger.class);

    static final int MAX_PAGE_SIZE = 100;

    private final AccountCreditsRepository accountRepository;
    private final CreditTransactionRepository transactionRepository;
    private final JdbcTemplate jdbcTemplate;
    private final ReelForgeProperties properties;
    private final Clock clock;

    public CreditLedger(AccountCreditsRepository accountRepository, CreditTransactionRepository transactionRepository,
            JdbcTemplate jdbcTemplate, ReelForgeProperties properties, Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Current balance without locking; may trail an in-flight mutation.
     */
    @Transactional(readOnly = true)
    public Optional<CreditBalance> getBalance(UUID accountId) {
        return accountRepository.findById(accountId).map(CreditBalance::of);
    }

    /**
     * Charge generation work.
     */
    public CreditReceipt debit(UUID accountId, int amount, String description, String referenceId) {
        return debit(accountId, amount, description, referenceId, TransactionType.GENERATION);
    }

    /**
     * Decrease a balance. Lifetime usage grows by the same amount.
     *
     * @param type {@link TransactionType#GENERATION} or {@link TransactionType#ADJUSTMENT}
     * @throws InvalidAmountException       if {@code amount <= 0}
     * @throws UserNotFoundException        if the account does not exist
     * @throws InsufficientCreditsException if the balance is below {@code amount}
     */
    @Transactional
    public CreditReceipt debit(UUID accountId, int amount, String description, String referenceId,
            TransactionType type) {
        requirePositive(amount);
        if (type == null || !TransactionType.DEBIT_TYPES.contains(type)) {
            throw new IllegalArgumentException("Debits must use one of " + TransactionType.DEBIT_TYPES + ", got " + type);
        }
        applyLockTimeout();
        AccountCredits account = accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new UserNotFoundException(accountId));

        int available = account.getCreditsRemaining();
        if (available < amount) {
            log.warn("Rejected debit of {} credits for account {}: only {} available", amount, accountId, available);
            throw new InsufficientCreditsException(accountId, available, amount);
        }

        account.applyDebit(amount);
        CreditTransaction transaction = appendTransaction(account, -amount, type, description, referenceId);
        log.info("Debited {} credits from account {} ({}), balance now {}", amount, accountId, type.getCode(),
                account.getCreditsRemaining());
        return CreditReceipt.of(transaction);
    }

    /**
     * Increase a balance. Lifetime usage is unaffected.
     *
     * @param type any type except {@link TransactionType#GENERATION}
     * @return the receipt, or empty if the account does not exist
     * @throws InvalidAmountException if {@code amount <= 0} or the balance would overflow
     */
    @Transactional
    public Optional<CreditReceipt> credit(UUID accountId, int amount, TransactionType type, String description,
            String referenceId) {
        requirePositive(amount);
        if (type == null || !TransactionType.CREDIT_TYPES.contains(type)) {
            throw new IllegalArgumentException("Credits must use one of " + TransactionType.CREDIT_TYPES + ", got "
                    + type);
        }
        applyLockTimeout();
        Optional<AccountCredits> locked = accountRepository.findByIdForUpdate(accountId);
        if (locked.isEmpty()) {
            log.warn("Credit of {} credits skipped: account {} not found", amount, accountId);
            return Optional.empty();
        }
        AccountCredits account = locked.get();
        try {
            account.applyCredit(amount);
        } catch (ArithmeticException e) {
            throw new InvalidAmountException(amount, "Crediting " + amount + " would overflow the balance of account "
                    + accountId, e);
        }
        CreditTransaction transaction = appendTransaction(account, amount, type, description, referenceId);
        log.info("Credited {} credits to account {} ({}), balance now {}", amount, accountId, type.getCode(),
                account.getCreditsRemaining());
        return Optional.of(CreditReceipt.of(transaction));
    }

    /**
     * Return credits charged for work that did not deliver.
     */
    public Optional<CreditReceipt> refund(UUID accountId, int amount, String referenceId, String description) {
        return credit(accountId, amount, TransactionType.REFUND, description, referenceId);
    }

    /**
     * Newest-first page of an account's ledger entries.
     *
     * @param limit  between 1 and 100
     * @param offset zero or more
     */
    @Transactional(readOnly = true)
    public List<CreditTransaction> listTransactions(UUID accountId, int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0");
        }
        return transactionRepository.findPageByAccountId(accountId, limit, offset);
    }

    /**
     * Every ledger entry carrying the given job id or external payment id.
     */
    @Transactional(readOnly = true)
    public List<CreditTransaction> findTransactionsByReference(String referenceId) {
        if (referenceId == null || referenceId.isBlank()) {
            return List.of();
        }
        return transactionRepository.findByReferenceIdOrderByCreatedAtAsc(referenceId);
    }

    /**
     * Change the plan fields only; grants no credits.
     *
     * @return the updated balance view, or empty if the account does not exist
     */
    @Transactional
    public Optional<CreditBalance> setSubscription(UUID accountId, SubscriptionTier tier, OffsetDateTime expiresAt,
            String externalSubscriptionRef) {
        if (tier == null) {
            throw new IllegalArgumentException("tier must not be null");
        }
        applyLockTimeout();
        return accountRepository.findByIdForUpdate(accountId).map(account -> {
            account.applySubscription(tier, expiresAt, externalSubscriptionRef);
            log.info("Account {} subscription set to {} until {}", accountId, tier.getCode(), expiresAt);
            return CreditBalance.of(account);
        });
    }

    /**
     * Set the plan and grant its configured credit allowance in one
     * transaction.
     *
     * @return the balance after the grant, or empty if the account does not exist
     */
    @Transactional
    public Optional<CreditBalance> provisionSubscription(UUID accountId, SubscriptionTier tier,
            OffsetDateTime expiresAt, String externalSubscriptionRef) {
        Optional<CreditBalance> updated = setSubscription(accountId, tier, expiresAt, externalSubscriptionRef);
        if (updated.isEmpty()) {
            return updated;
        }
        int grant = properties.getCredits().grantFor(tier);
        if (grant <= 0) {
            return updated;
        }
        return credit(accountId, grant, TransactionType.SUBSCRIPTION,
                "Subscription credits (" + tier.getCode() + ")", externalSubscriptionRef)
                .flatMap(receipt -> accountRepository.findById(accountId).map(CreditBalance::of));
    }

    private CreditTransaction appendTransaction(AccountCredits account, int signedAmount, TransactionType type,
            String description, String referenceId) {
        CreditTransaction transaction = new CreditTransaction(UUID.randomUUID(), account.getId(), signedAmount, type,
                description, referenceId, account.getCreditsRemaining(), OffsetDateTime.now(clock));
        return transactionRepository.save(transaction);
    }

    private void requirePositive(int amount) {
        if (amount <= 0) {
            throw new InvalidAmountException(amount);
        }
    }

    private void applyLockTimeout() {
        long timeoutMs = properties.getCredits().getLockTimeoutMs();
        if (timeoutMs > 0) {
            jdbcTemplate.execute("SET LOCAL lock_timeout = '" + timeoutMs + "ms'");
        }
    }
}
