package com.flagship.currency_ledger.support;

import com.flagship.currency_ledger.account.Account;
import com.flagship.currency_ledger.account.AccountService;
import com.flagship.currency_ledger.account.AccountType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Spring context against a real Postgres, shared by the integration tests.
 *
 * Kafka, Redis, the outbox publisher and the rate consumer are switched off.
 * Balance events cannot be deleted, so tests never clean up; each one opens its
 * own accounts under a fresh company id and uses its own currency codes where
 * rates are involved.
 */
@SpringBootTest
public abstract class LedgerIntegrationTest {

    protected static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("currency_ledger_test")
            .withUsername("test")
            .withPassword("test");

    static {
        postgres.start();
    }

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.autoconfigure.exclude", () ->
                "org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration,"
                + "org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration");
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("ledger.lock-timeout", () -> "2s");
    }

    @Autowired
    protected AccountService accountService;

    protected final UUID companyId = UUID.randomUUID();

    protected Account openAccount(String currency, String openingBalance) {
        return accountService.openAccount(
                "ACC-" + UUID.randomUUID().toString().substring(0, 8),
                "Test " + currency + " account",
                currency,
                AccountType.CASH,
                companyId,
                new BigDecimal(openingBalance));
    }

    protected Account reload(Account account) {
        return accountService.getAccount(account.getId());
    }

    /**
     * Random currency code no other test has rates for.
     */
    protected static String uniqueCurrency() {
        StringBuilder code = new StringBuilder("Q");
        for (int i = 0; i < 7; i++) {
            code.append((char) ('A' + ThreadLocalRandom.current().nextInt(26)));
        }
        return code.toString();
    }

    protected void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    protected void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    protected void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    protected void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }
}
