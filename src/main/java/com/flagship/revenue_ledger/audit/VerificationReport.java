package com.flagship.revenue_ledger.audit;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of recomputing a client's hash chain. When {@code valid} is false the
 * {@code broken*} fields name the first entry that failed and why.
 */
@Value
@Builder
public class VerificationReport {

    @JsonProperty("client_id")
    String clientId;

    @JsonProperty("from")
    Instant from;

    @JsonProperty("to")
    Instant to;

    @JsonProperty("entries_checked")
    long entriesChecked;

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("last_hash")
    String lastHash;

    @JsonProperty("broken_sequence")
    Long brokenSequence;

    @JsonProperty("broken_entry_hash")
    String brokenEntryHash;

    @JsonProperty("reason")
    String reason;
}
