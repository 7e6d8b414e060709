package com.reelforge.credits;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, UUID> {

    @Query(value = """
            SELECT * FROM credit_transactions
            WHERE account_id = :accountId
            ORDER BY created_at DESC, seq DESC
            LIMIT :limit OFFSET :offset
            """, nativeQuery = true)
    List<CreditTransaction> findPageByAccountId(@Param("accountId") UUID accountId, @Param("limit") int limit,
            @Param("offset") int offset);

    List<CreditTransaction> findByReferenceIdOrderByCreatedAtAsc(String referenceId);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM CreditTransaction t WHERE t.accountId = :accountId")
    long sumAmountByAccountId(@Param("accountId") UUID accountId);

    long countByAccountId(UUID accountId);
}
