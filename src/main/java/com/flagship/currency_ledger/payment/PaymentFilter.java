package com.flagship.currency_ledger.payment;

import jakarta.persistence.criteria.Predicate;
import lombok.Builder;
import lombok.Value;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Optional criteria for listing payments; null fields do not filter.
 */
@Value
@Builder
public class PaymentFilter {
    PaymentType type;
    PaymentChannel channel;
    UUID accountId;
    UUID contactId;
    Instant from;
    Instant to;

    Specification<PaymentEntity> toSpecification() {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (type != null) {
                predicates.add(cb.equal(root.get("type"), type));
            }
            if (channel != null) {
                predicates.add(cb.equal(root.get("channel"), channel));
            }
            if (accountId != null) {
                predicates.add(cb.equal(root.get("accountId"), accountId));
            }
            if (contactId != null) {
                predicates.add(cb.equal(root.get("contactId"), contactId));
            }
            if (from != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("paymentDate"), from));
            }
            if (to != null) {
                predicates.add(cb.lessThan(root.get("paymentDate"), to));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
