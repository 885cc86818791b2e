package com.flagship.currency_ledger.transfer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface TransferRepository extends JpaRepository<TransferEntity, UUID> {

    @Query("""
        SELECT t FROM TransferEntity t
        WHERE t.fromAccountId = :accountId OR t.toAccountId = :accountId
        ORDER BY t.transferDate DESC
        """)
    List<TransferEntity> findByAccount(@Param("accountId") UUID accountId);

    List<TransferEntity> findAllByOrderByTransferDateDesc();
}
