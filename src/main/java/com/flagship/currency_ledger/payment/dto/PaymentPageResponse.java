package com.flagship.currency_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.currency_ledger.payment.Payment;
import lombok.Value;
import org.springframework.data.domain.Page;

import java.util.List;

@Value
public class PaymentPageResponse {

    @JsonProperty("items")
    List<PaymentResponse> items;

    @JsonProperty("page")
    int page;

    @JsonProperty("size")
    int size;

    @JsonProperty("total_items")
    long totalItems;

    public static PaymentPageResponse from(Page<Payment> page) {
        return new PaymentPageResponse(
            page.getContent().stream().map(PaymentResponse::from).toList(),
            page.getNumber(),
            page.getSize(),
            page.getTotalElements()
        );
    }
}
