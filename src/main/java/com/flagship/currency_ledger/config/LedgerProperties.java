package com.flagship.currency_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Ledger-wide settings bound from the {@code ledger.*} keys.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    /** Currency every exchange rate is quoted against. */
    @NotBlank
    private String baseCurrency = "TRY";

    /** Default target currency of profit and currency reports. */
    @NotBlank
    private String reportingCurrency = "TRY";

    /** Zone used to derive business dates (rate dates, document number days). */
    private ZoneId zone = ZoneId.of("Europe/Istanbul");

    /** Longest wait for an account row lock before the write is abandoned. */
    private Duration lockTimeout = Duration.ofSeconds(5);

    private final Confirmation confirmation = new Confirmation();

    @Getter
    @Setter
    public static class Confirmation {
        private Duration ttl = Duration.ofMinutes(5);
    }
}
