package com.flagship.currency_ledger.payment;

import com.flagship.currency_ledger.confirmation.DeletionRequest;
import com.flagship.currency_ledger.payment.dto.CreatePaymentRequest;
import com.flagship.currency_ledger.payment.dto.PaymentPageResponse;
import com.flagship.currency_ledger.payment.dto.PaymentResponse;
import com.flagship.currency_ledger.payment.dto.UpdatePaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.UUID;

/**
 * Payments API. Deleting a payment is two calls: request a confirmation token,
 * then delete with it.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private final PaymentLedgerService paymentLedgerService;

    @PostMapping
    public ResponseEntity<PaymentResponse> createPayment(@Valid @RequestBody CreatePaymentRequest request) {
        log.info("Received payment request: type={}, amount={}, currency={}, accountId={}",
                request.getPaymentType(), request.getAmount(), request.getCurrency(), request.getAccountId());
        Payment payment = paymentLedgerService.createPayment(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(payment));
    }

    @GetMapping("/{id}")
    public PaymentResponse getPayment(@PathVariable("id") UUID id) {
        return PaymentResponse.from(paymentLedgerService.getPayment(id));
    }

    @GetMapping
    public PaymentPageResponse listPayments(
            @RequestParam(value = "payment_type", required = false) String type,
            @RequestParam(value = "payment_channel", required = false) String channel,
            @RequestParam(value = "account_id", required = false) UUID accountId,
            @RequestParam(value = "contact_id", required = false) UUID contactId,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "50") int size) {
        PaymentFilter filter = PaymentFilter.builder()
            .type(type != null ? PaymentType.fromCode(type) : null)
            .channel(channel != null ? PaymentChannel.fromCode(channel) : null)
            .accountId(accountId)
            .contactId(contactId)
            .from(from)
            .to(to)
            .build();
        return PaymentPageResponse.from(paymentLedgerService.listPayments(filter, page, size));
    }

    @PutMapping("/{id}")
    public PaymentResponse updatePayment(@PathVariable("id") UUID id,
                                         @Valid @RequestBody UpdatePaymentRequest request) {
        return PaymentResponse.from(paymentLedgerService.updatePayment(id, request.toCommand()));
    }

    @PostMapping("/{id}/deletion-requests")
    public ResponseEntity<DeletionRequest> requestDeletion(@PathVariable("id") UUID id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(paymentLedgerService.requestDeletion(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePayment(
            @PathVariable("id") UUID id,
            @RequestParam(value = "confirmationToken", required = false) String confirmationToken) {
        paymentLedgerService.deletePayment(id, confirmationToken);
        return ResponseEntity.noContent().build();
    }
}
