package com.flagship.currency_ledger.account;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AccountRepository extends JpaRepository<AccountEntity, UUID> {

    /**
     * {@code SELECT ... FOR UPDATE} on one account row. Callers holding more than one
     * lock must acquire them through {@link AccountService#lockInOrder}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM AccountEntity a WHERE a.id = :id")
    Optional<AccountEntity> findByIdForUpdate(@Param("id") UUID id);

    boolean existsByCompanyIdAndCode(UUID companyId, String code);

    List<AccountEntity> findAllByOrderByCodeAsc();

    List<AccountEntity> findByCompanyIdOrderByCodeAsc(UUID companyId);

    List<AccountEntity> findByTypeOrderByCodeAsc(AccountType type);

    List<AccountEntity> findByCompanyIdAndTypeOrderByCodeAsc(UUID companyId, AccountType type);

    /**
     * Rows are {@code [currency, sum(balance), count]}, one per account currency.
     */
    @Query("SELECT a.currency, SUM(a.balance), COUNT(a) FROM AccountEntity a GROUP BY a.currency ORDER BY a.currency")
    List<Object[]> sumBalancesByCurrency();
}
