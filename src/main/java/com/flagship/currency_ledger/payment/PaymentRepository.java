package com.flagship.currency_ledger.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID>,
        JpaSpecificationExecutor<PaymentEntity> {

    Optional<PaymentEntity> findByPaymentNo(String paymentNo);

    /**
     * Locks the payment row. Edits and deletions take this lock before any account lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.id = :id")
    Optional<PaymentEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Payment totals per currency and type code in a period, for currency summaries.
     * Rows are {@code [currency, PaymentType, sum(amount)]}.
     */
    @Query("""
        SELECT p.currency, p.type, SUM(p.amount) FROM PaymentEntity p
        WHERE p.paymentDate >= :from AND p.paymentDate < :to
        GROUP BY p.currency, p.type
        """)
    List<Object[]> sumByCurrencyAndType(@Param("from") Instant from, @Param("to") Instant to);

    /**
     * Rows are {@code [PaymentChannel, PaymentType, currency, count, sum(amount), sum(baseAmount)]}.
     */
    @Query("""
        SELECT p.channel, p.type, p.currency, COUNT(p), SUM(p.amount), SUM(p.baseAmount) FROM PaymentEntity p
        WHERE p.paymentDate >= :from AND p.paymentDate < :to
        GROUP BY p.channel, p.type, p.currency
        ORDER BY p.channel, p.type, p.currency
        """)
    List<Object[]> sumByChannelAndType(@Param("from") Instant from, @Param("to") Instant to);

    /**
     * Daily payment flows, the day taken in {@code zone}.
     * Rows are {@code [day, type code, channel code, currency, count, sum(amount)]}.
     */
    @Query(value = """
        SELECT CAST(p.payment_date AT TIME ZONE :zone AS DATE) AS day, p.payment_type, p.payment_channel,
               p.currency, COUNT(*), SUM(p.amount)
        FROM payments p
        WHERE p.payment_date >= :from AND p.payment_date < :to
        GROUP BY 1, 2, 3, 4
        ORDER BY 1, 2, 3, 4
        """, nativeQuery = true)
    List<Object[]> dailyFlows(@Param("zone") String zone, @Param("from") Instant from, @Param("to") Instant to);

    @Query(value = """
        SELECT CAST(p.payment_date AT TIME ZONE :zone AS DATE) AS day, p.payment_type, p.payment_channel,
               p.currency, COUNT(*), SUM(p.amount)
        FROM payments p
        WHERE p.account_id = :accountId AND p.payment_date >= :from AND p.payment_date < :to
        GROUP BY 1, 2, 3, 4
        ORDER BY 1, 2, 3, 4
        """, nativeQuery = true)
    List<Object[]> dailyFlowsForAccount(@Param("zone") String zone, @Param("accountId") UUID accountId,
                                        @Param("from") Instant from, @Param("to") Instant to);
}
