package com.flagship.currency_ledger.payment;

import com.flagship.currency_ledger.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PaymentTypeTest {

    @ParameterizedTest(name = "{0} moves the balance by {1} x amount")
    @CsvSource({
        "incoming, 1",
        "outgoing, -1",
        "intra_company_in, 1",
        "intra_company_out, -1",
        "inter_company_in, 1",
        "inter_company_out, -1",
        "currency_purchase, 1",
        "currency_sale, -1"
    })
    void signedAmount_followsDirection(String code, int sign) {
        PaymentType type = PaymentType.fromCode(code);

        BigDecimal effect = type.signedAmount(new BigDecimal("250.50"));

        assertEquals(0, new BigDecimal("250.50").multiply(BigDecimal.valueOf(sign)).compareTo(effect));
        assertEquals(code, type.getCode());
    }

    @Test
    @DisplayName("Document prefix follows the direction")
    void documentPrefix() {
        assertEquals("PMI", PaymentType.CURRENCY_PURCHASE.getDirection().getDocumentPrefix());
        assertEquals("PMO", PaymentType.INTER_COMPANY_OUT.getDirection().getDocumentPrefix());
    }

    @Test
    @DisplayName("Unknown codes are rejected as validation errors")
    void fromCode_unknown() {
        assertThrows(ValidationException.class, () -> PaymentType.fromCode("refund"));
        assertThrows(ValidationException.class, () -> PaymentChannel.fromCode("cheque"));
    }

    @Test
    @DisplayName("Enum names are accepted as well as wire codes")
    void fromCode_enumName() {
        assertEquals(PaymentType.INTRA_COMPANY_IN, PaymentType.fromCode("INTRA_COMPANY_IN"));
        assertEquals(PaymentChannel.BANK_TRANSFER, PaymentChannel.fromCode("bank_transfer"));
    }
}
