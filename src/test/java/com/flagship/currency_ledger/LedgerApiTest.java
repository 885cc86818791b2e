package com.flagship.currency_ledger;

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
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of accounts, transfers, rates, transactions and reports.
 */
@AutoConfigureMockMvc
class LedgerApiTest extends LedgerIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private final LocalDate today = LocalDate.now(ZoneId.of("Europe/Istanbul"));

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private static void assertAmount(String expected, JsonNode node) {
        assertEquals(0, new BigDecimal(expected).compareTo(node.decimalValue()),
                "Expected " + expected + " but was " + node);
    }

    private void putRate(String currency, LocalDate date, String buying) throws Exception {
        mockMvc.perform(put("/api/exchange-rates/" + currency + "/" + date)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"buying_rate\":" + buying + ",\"selling_rate\":" + buying
                                + ",\"source\":\"manual\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currency").value(currency))
                .andExpect(jsonPath("$.rate_date").value(date.toString()));
    }

    @Test
    @DisplayName("Accounts open with an opening balance and expose history and reconciliation")
    void testAccountLifecycle() throws Exception {
        printTestHeader("Account API");

        String body = "{\"code\":\"API-" + UUID.randomUUID().toString().substring(0, 8) + "\","
                + "\"name\":\"Main cash\",\"currency\":\"try\",\"account_type\":\"CASH\","
                + "\"company_id\":\"" + companyId + "\",\"opening_balance\":250}";

        JsonNode account = json(mockMvc.perform(post("/api/accounts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn());
        String id = account.get("id").asText();
        printOutput("Account", account);

        assertEquals("TRY", account.get("currency").asText());
        assertAmount("250", account.get("balance"));

        mockMvc.perform(get("/api/accounts/" + id + "/history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_events").value(1))
                .andExpect(jsonPath("$.events[0].event_type").value("OPENING"));

        mockMvc.perform(get("/api/accounts/" + id + "/reconciliation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balanced").value(true));

        mockMvc.perform(get("/api/accounts").param("company_id", companyId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(post("/api/accounts/" + id + "/deactivate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(get("/api/accounts/" + UUID.randomUUID()))
                .andExpect(status().isNotFound());

        printSuccess("Account opened, audited and deactivated");
    }

    @Test
    @DisplayName("Transfers convert through the rate store and reject the same account")
    void testTransfers() throws Exception {
        printTestHeader("Transfer API");

        String currency = uniqueCurrency();
        putRate(currency, today, "30");
        Account foreign = openAccount(currency, "100");
        Account base = openAccount("TRY", "0");

        JsonNode transfer = json(mockMvc.perform(post("/api/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from_account_id\":\"" + foreign.getId() + "\","
                                + "\"to_account_id\":\"" + base.getId() + "\",\"from_amount\":100}"))
                .andExpect(status().isCreated())
                .andReturn());
        printOutput("Transfer", transfer);

        assertTrue(transfer.get("transfer_no").asText().startsWith("VRM"));
        assertAmount("3000", transfer.get("to_amount"));
        assertAmount("30", transfer.get("exchange_rate"));

        mockMvc.perform(get("/api/transfers/" + transfer.get("id").asText()))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/transfers").param("account_id", base.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        mockMvc.perform(post("/api/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from_account_id\":\"" + base.getId() + "\","
                                + "\"to_account_id\":\"" + base.getId() + "\",\"from_amount\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        Account unrated = openAccount(uniqueCurrency(), "50");
        mockMvc.perform(post("/api/transfers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"from_account_id\":\"" + unrated.getId() + "\","
                                + "\"to_account_id\":\"" + base.getId() + "\",\"from_amount\":10}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("RATE_UNAVAILABLE"));

        printSuccess("Transfer created, invalid ones rejected");
    }

    @Test
    @DisplayName("Rates are recorded, read back and crossed through the base currency")
    void testExchangeRates() throws Exception {
        printTestHeader("Exchange Rate API");

        String first = uniqueCurrency();
        String second = uniqueCurrency();
        putRate(first, today, "35");
        putRate(second, today, "32");

        mockMvc.perform(get("/api/exchange-rates/" + first + "/" + today))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("manual"));
        mockMvc.perform(get("/api/exchange-rates/" + first + "/latest"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/api/exchange-rates").param("currency", first))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        mockMvc.perform(get("/api/exchange-rates/" + first + "/" + today.minusYears(5)))
                .andExpect(status().isNotFound());

        JsonNode cross = json(mockMvc.perform(get("/api/exchange-rates/cross")
                        .param("from", first)
                        .param("to", second)
                        .param("date", today.toString()))
                .andExpect(status().isOk())
                .andReturn());
        assertAmount("1.09375", cross.get("rate"));

        mockMvc.perform(get("/api/exchange-rates/cross")
                        .param("from", first)
                        .param("to", uniqueCurrency()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("RATE_UNAVAILABLE"));

        mockMvc.perform(put("/api/exchange-rates/TRY/" + today)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"buying_rate\":1,\"selling_rate\":1}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/exchange-rates/" + first + "/" + today)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"buying_rate\":-1,\"selling_rate\":1}"))
                .andExpect(status().isBadRequest());

        printSuccess("35 / 32 = 1.09375");
    }

    @Test
    @DisplayName("Sales are recorded and show up in the profit/loss and currency reports")
    void testTransactionsAndReports() throws Exception {
        printTestHeader("Transactions And Reports API");

        UUID product = UUID.randomUUID();
        String body = "{\"transaction_type\":\"sale\",\"company_id\":\"" + companyId + "\","
                + "\"currency\":\"TRY\",\"items\":[{\"product_id\":\"" + product + "\","
                + "\"description\":\"Widget\",\"quantity\":3,\"unit_price\":40,\"cost_price\":25}]}";

        JsonNode transaction = json(mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andReturn());
        printOutput("Transaction", transaction);

        assertTrue(transaction.get("transaction_no").asText().startsWith("SLS"));
        assertAmount("120", transaction.get("subtotal"));
        assertAmount("45", transaction.get("total_profit"));
        assertAmount("37.5", transaction.get("items").get(0).get("margin_pct"));

        mockMvc.perform(get("/api/transactions/" + transaction.get("id").asText()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(1));

        JsonNode report = json(mockMvc.perform(get("/api/reports/profit-loss")
                        .param("from", today.minusDays(1).toString())
                        .param("to", today.plusDays(1).toString())
                        .param("group_by", "product")
                        .param("company_id", companyId.toString()))
                .andExpect(status().isOk())
                .andReturn());
        printOutput("Report", report);

        assertEquals("product", report.get("group_by").asText());
        assertEquals(product.toString(), report.get("groups").get(0).get("key").asText());
        assertAmount("45", report.get("total").get("profit"));
        assertTrue(report.get("total").get("complete").asBoolean());

        mockMvc.perform(get("/api/reports/profit-loss").param("group_by", "weather"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/reports/profit-loss")
                        .param("from", today.toString())
                        .param("to", today.minusDays(3).toString()))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/reports/currency-summary").param("reporting_currency", "TRY"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.reporting_currency").value("TRY"))
                .andExpect(jsonPath("$.currencies").isArray());

        Account account = openAccount("TRY", "0");
        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"payment_type\":\"incoming\",\"payment_channel\":\"paytr\",\"amount\":40,"
                                + "\"currency\":\"TRY\",\"account_id\":\"" + account.getId() + "\"}"))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/reports/payment-channels")
                        .param("from", today.minusDays(1).toString())
                        .param("to", today.plusDays(1).toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.channels[?(@.channel == 'paytr')]").exists());

        JsonNode cashFlow = json(mockMvc.perform(get("/api/reports/cash-flow")
                        .param("from", today.minusDays(1).toString())
                        .param("to", today.plusDays(1).toString())
                        .param("account_id", account.getId().toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.account_id").value(account.getId().toString()))
                .andExpect(jsonPath("$.flows.length()").value(1))
                .andExpect(jsonPath("$.flows[0].type").value("incoming"))
                .andExpect(jsonPath("$.flows[0].channel").value("paytr"))
                .andReturn());
        assertAmount("40", cashFlow.get("flows").get(0).get("amount"));

        mockMvc.perform(get("/api/reports/cash-flow").param("account_id", UUID.randomUUID().toString()))
                .andExpect(status().isNotFound());

        printSuccess("Sale recorded and reported");
    }

    @Test
    @DisplayName("Health endpoint reports the database")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.database").value("UP"));
    }
}
