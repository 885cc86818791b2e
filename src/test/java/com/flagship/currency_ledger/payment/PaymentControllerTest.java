package com.flagship.currency_ledger.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.currency_ledger.account.Account;
import com.flagship.currency_ledger.support.LedgerIntegrationTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Payment endpoints, including error statuses and the two-step deletion.
 */
@AutoConfigureMockMvc
class PaymentControllerTest extends LedgerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static void assertAmount(String expected, JsonNode node) {
        assertEquals(0, new BigDecimal(expected).compareTo(node.decimalValue()),
                "Expected " + expected + " but was " + node);
    }

    private static String paymentJson(String type, String amount, String currency, UUID accountId) {
        return "{"
                + "\"payment_type\":\"" + type + "\","
                + "\"payment_channel\":\"bank_transfer\","
                + "\"amount\":" + amount + ","
                + "\"currency\":\"" + currency + "\","
                + "\"account_id\":\"" + accountId + "\","
                + "\"description\":\"Invoice 42\""
                + "}";
    }

    private JsonNode createPayment(String type, String amount, Account account) throws Exception {
        return json(mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentJson(type, amount, account.getCurrency(), account.getId())))
                .andExpect(status().isCreated())
                .andReturn());
    }

    @Test
    @DisplayName("POST /api/payments records the payment and moves the balance")
    void testCreatePayment_Created() throws Exception {
        printTestHeader("Create Payment API");

        Account account = openAccount("TRY", "1000");
        JsonNode payment = createPayment("incoming", "500.00", account);

        printOutput("Response", payment);

        assertTrue(payment.get("payment_no").asText().startsWith("PMI"));
        assertEquals("incoming", payment.get("payment_type").asText());
        assertEquals("bank_transfer", payment.get("payment_channel").asText());
        assertAmount("500", payment.get("amount"));
        assertAmount("1", payment.get("exchange_rate"));

        JsonNode fetched = json(mockMvc.perform(get("/api/payments/" + payment.get("id").asText()))
                .andExpect(status().isOk())
                .andReturn());
        assertEquals(payment.get("payment_no").asText(), fetched.get("payment_no").asText());

        JsonNode accountJson = json(mockMvc.perform(get("/api/accounts/" + account.getId()))
                .andExpect(status().isOk())
                .andReturn());
        assertAmount("1500", accountJson.get("balance"));

        printSuccess("201 Created and balance 1500");
    }

    @Test
    @DisplayName("Invalid payment requests are answered with 400")
    void testCreatePayment_BadRequest() throws Exception {
        printTestHeader("Create Payment API - Validation");

        Account account = openAccount("TRY", "0");

        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentJson("incoming", "0", "TRY", account.getId())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.amount").exists());

        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentJson("incoming", "0.00004", "TRY", account.getId())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentJson("sideways", "10", "TRY", account.getId())))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payment_type\":\"incoming\"}"))
                .andExpect(status().isBadRequest());

        assertEquals(0, BigDecimal.ZERO.compareTo(reload(account).getBalance()));

        printSuccess("Non-positive and sub-scale amounts, unknown type and missing fields rejected");
    }

    @Test
    @DisplayName("Currency mismatch and missing rate are answered with 422")
    void testCreatePayment_Unprocessable() throws Exception {
        Account account = openAccount("TRY", "0");
        Account foreign = openAccount(uniqueCurrency(), "0");

        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentJson("incoming", "10", "USD", account.getId())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("CURRENCY_MISMATCH"))
                .andExpect(jsonPath("$.retryable").value(false));

        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentJson("incoming", "10", foreign.getCurrency(), foreign.getId())))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("RATE_UNAVAILABLE"));
    }

    @Test
    @DisplayName("Unknown payments and accounts are answered with 404")
    void testUnknownPayment_NotFound() throws Exception {
        mockMvc.perform(get("/api/payments/" + UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentJson("incoming", "10", "TRY", UUID.randomUUID())))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("PUT /api/payments/{id} re-books the payment")
    void testUpdatePayment() throws Exception {
        Account account = openAccount("TRY", "100");
        JsonNode payment = createPayment("outgoing", "40", account);

        mockMvc.perform(put("/api/payments/" + payment.get("id").asText())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":25}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payment_no").value(payment.get("payment_no").asText()));

        assertEquals(0, new BigDecimal("75").compareTo(reload(account).getBalance()));
    }

    @Test
    @DisplayName("Deletion needs a token from a deletion request")
    void testDeletePayment_TwoSteps() throws Exception {
        printTestHeader("Delete Payment API");

        Account account = openAccount("TRY", "1000");
        JsonNode payment = createPayment("incoming", "200", account);
        String id = payment.get("id").asText();

        mockMvc.perform(delete("/api/payments/" + id))
                .andExpect(status().isBadRequest());

        JsonNode request = json(mockMvc.perform(post("/api/payments/" + id + "/deletion-requests"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.target_type").value("Payment"))
                .andExpect(jsonPath("$.target_id").value(id))
                .andReturn());
        String token = request.get("confirmation_token").asText();
        printOutput("Deletion request", request);

        mockMvc.perform(delete("/api/payments/" + id).param("confirmationToken", "wrong"))
                .andExpect(status().isBadRequest());
        assertEquals(0, new BigDecimal("1200").compareTo(reload(account).getBalance()));

        mockMvc.perform(delete("/api/payments/" + id).param("confirmationToken", token))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/payments/" + id))
                .andExpect(status().isNotFound());
        assertEquals(0, new BigDecimal("1000").compareTo(reload(account).getBalance()));

        printSuccess("204 with the right token, balance restored");
    }

    @Test
    @DisplayName("GET /api/payments filters by account and pages the result")
    void testListPayments() throws Exception {
        Account account = openAccount("TRY", "0");
        createPayment("incoming", "10", account);
        createPayment("incoming", "20", account);
        createPayment("outgoing", "5", account);

        JsonNode page = json(mockMvc.perform(get("/api/payments")
                        .param("account_id", account.getId().toString())
                        .param("payment_type", "incoming")
                        .param("size", "1"))
                .andExpect(status().isOk())
                .andReturn());

        assertEquals(2, page.get("total_items").asLong());
        assertEquals(1, page.get("items").size());

        mockMvc.perform(get("/api/payments").param("size", "0"))
                .andExpect(status().isBadRequest());
    }
}
