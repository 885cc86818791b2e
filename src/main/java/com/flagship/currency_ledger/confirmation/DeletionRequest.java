package com.flagship.currency_ledger.confirmation;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Issued confirmation for one pending destructive operation.
 */
@Value
public class DeletionRequest {

    @JsonProperty("confirmation_token")
    String token;

    @JsonProperty("target_type")
    String targetType;

    @JsonProperty("target_id")
    UUID targetId;

    @JsonProperty("expires_at")
    Instant expiresAt;
}
