package com.flagship.currency_ledger.payment;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Converter;
import jakarta.persistence.Entity;
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
 * JPA mapping of {@code payments}.
 *
 * No setters: a payment is created through {@link #fromDomain} and changed only
 * through {@link #updateFromDomain}, which never touches the id or payment number.
 */
@Entity
@Table(name = "payments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "payment_no", nullable = false, updatable = false, length = 50)
    private String paymentNo;

    @Convert(converter = TypeConverter.class)
    @Column(name = "payment_type", nullable = false, length = 30)
    private PaymentType type;

    @Convert(converter = ChannelConverter.class)
    @Column(name = "payment_channel", nullable = false, length = 30)
    private PaymentChannel channel;

    @Column(nullable = false, precision = 18, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, length = 10)
    private String currency;

    @Column(name = "exchange_rate", nullable = false, precision = 18, scale = 8)
    private BigDecimal exchangeRate;

    @Column(name = "base_amount", nullable = false, precision = 18, scale = 4)
    private BigDecimal baseAmount;

    @Column(name = "contact_id")
    private UUID contactId;

    @Column(name = "account_id", nullable = false)
    private UUID accountId;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "reference_no", length = 100)
    private String referenceNo;

    @Column(name = "payment_date", nullable = false)
    private Instant paymentDate;

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

    static PaymentEntity fromDomain(Payment payment) {
        return new PaymentEntity(
            payment.getId(),
            payment.getPaymentNo(),
            payment.getType(),
            payment.getChannel(),
            payment.getAmount(),
            payment.getCurrency(),
            payment.getExchangeRate(),
            payment.getBaseAmount(),
            payment.getContactId(),
            payment.getAccountId(),
            payment.getDescription(),
            payment.getReferenceNo(),
            payment.getPaymentDate(),
            null,
            null
        );
    }

    public Payment toDomain() {
        return new Payment(id, paymentNo, type, channel, amount, currency, exchangeRate, baseAmount,
                contactId, accountId, description, referenceNo, paymentDate, createdAt, updatedAt);
    }

    void updateFromDomain(Payment payment) {
        this.type = payment.getType();
        this.channel = payment.getChannel();
        this.amount = payment.getAmount();
        this.currency = payment.getCurrency();
        this.exchangeRate = payment.getExchangeRate();
        this.baseAmount = payment.getBaseAmount();
        this.contactId = payment.getContactId();
        this.accountId = payment.getAccountId();
        this.description = payment.getDescription();
        this.referenceNo = payment.getReferenceNo();
        this.paymentDate = payment.getPaymentDate();
    }

    @Converter
    public static class TypeConverter implements AttributeConverter<PaymentType, String> {
        @Override
        public String convertToDatabaseColumn(PaymentType attribute) {
            return attribute != null ? attribute.getCode() : null;
        }

        @Override
        public PaymentType convertToEntityAttribute(String dbData) {
            return dbData != null ? PaymentType.fromCode(dbData) : null;
        }
    }

    @Converter
    public static class ChannelConverter implements AttributeConverter<PaymentChannel, String> {
        @Override
        public String convertToDatabaseColumn(PaymentChannel attribute) {
            return attribute != null ? attribute.getCode() : null;
        }

        @Override
        public PaymentChannel convertToEntityAttribute(String dbData) {
            return dbData != null ? PaymentChannel.fromCode(dbData) : null;
        }
    }
}
