package com.flagship.currency_ledger.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@code accounts}.
 *
 * There is no balance setter: the balance column is moved only by
 * {@code LedgerService}, in the same statement that records the balance event.
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 50, updatable = false)
    private String code;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 10, updatable = false)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "account_type", nullable = false, length = 30)
    private AccountType type;

    @Column(nullable = false, precision = 18, scale = 4, updatable = false)
    private BigDecimal balance;

    @Column(name = "company_id", nullable = false, updatable = false)
    private UUID companyId;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * New accounts always start at zero; an opening balance is posted as an event afterwards.
     */
    static AccountEntity open(String code, String name, String currency, AccountType type, UUID companyId) {
        return new AccountEntity(UUID.randomUUID(), code, name, currency, type,
                BigDecimal.ZERO, companyId, true, null, null);
    }

    void deactivate() {
        this.active = false;
    }

    public Account toDomain() {
        return new Account(id, code, name, currency, type, balance, companyId, active, createdAt, updatedAt);
    }
}
