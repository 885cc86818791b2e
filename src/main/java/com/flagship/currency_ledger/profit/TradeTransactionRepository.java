package com.flagship.currency_ledger.profit;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TradeTransactionRepository extends JpaRepository<TradeTransactionEntity, UUID> {

    @EntityGraph(attributePaths = "items")
    Optional<TradeTransactionEntity> findWithItemsById(UUID id);

    /**
     * Lines of one transaction type dated in {@code [from, to)}, with their headers.
     */
    @Query("""
        SELECT i FROM TransactionItemEntity i JOIN FETCH i.transaction t
        WHERE t.type = :type AND t.transactionDate >= :from AND t.transactionDate < :to
        ORDER BY t.transactionDate, t.transactionNo, i.lineNumber
        """)
    List<TransactionItemEntity> findLines(@Param("type") TradeTransactionType type,
                                          @Param("from") Instant from,
                                          @Param("to") Instant to);

    @Query("""
        SELECT i FROM TransactionItemEntity i JOIN FETCH i.transaction t
        WHERE t.type = :type AND t.companyId = :companyId
          AND t.transactionDate >= :from AND t.transactionDate < :to
        ORDER BY t.transactionDate, t.transactionNo, i.lineNumber
        """)
    List<TransactionItemEntity> findLinesForCompany(@Param("type") TradeTransactionType type,
                                                    @Param("companyId") UUID companyId,
                                                    @Param("from") Instant from,
                                                    @Param("to") Instant to);
}
