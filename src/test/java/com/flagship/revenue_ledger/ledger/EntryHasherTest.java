package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.attribution.Agent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntryHasherTest {

    private static LedgerEntry entry() {
        return LedgerEntry.builder()
                .previousHash(EntryHasher.GENESIS_HASH)
                .clientId("client-1")
                .platform("shopify")
                .internalOrderId("int-1001")
                .externalOrderId("ext-1001")
                .orderAmount(new BigDecimal("99.99"))
                .attributed(true)
                .attributionConfidence(new BigDecimal("0.8500"))
                .baselineRevenue(new BigDecimal("70.00"))
                .incrementalRevenue(new BigDecimal("29.99"))
                .upliftPercentage(new BigDecimal("42.84"))
                .baselineAdSpend(new BigDecimal("10.00"))
                .incrementalAdSpend(new BigDecimal("0.00"))
                .netProfitUplift(new BigDecimal("29.99"))
                .feeAmount(new BigDecimal("6.00"))
                .feeApplicable(true)
                .contributingAgents(List.of(Agent.PLATFORM))
                .explanation("Attributed to Platform with 85% confidence.")
                .createdAt(Instant.parse("2026-01-15T10:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Genesis hash is 64 zeros")
    void genesis() {
        assertEquals(64, EntryHasher.GENESIS_HASH.length());
        assertTrue(EntryHasher.GENESIS_HASH.chars().allMatch(c -> c == '0'));
    }

    @Test
    @DisplayName("Hash is a stable 64-char hex SHA-256")
    void stable() {
        String hash = EntryHasher.hash(entry());

        assertEquals(64, hash.length());
        assertTrue(hash.matches("[0-9a-f]{64}"));
        assertEquals(hash, EntryHasher.hash(entry()));
    }

    @Test
    @DisplayName("Changing a financial field or the predecessor changes the hash")
    void coversFinancialFieldsAndChain() {
        String original = EntryHasher.hash(entry());

        assertNotEquals(original, EntryHasher.hash(entry().toBuilder().feeAmount(new BigDecimal("6.01")).build()));
        assertNotEquals(original, EntryHasher.hash(entry().toBuilder().previousHash("a".repeat(64)).build()));
        assertNotEquals(original, EntryHasher.hash(entry().toBuilder().externalOrderId("ext-1002").build()));
    }

    @Test
    @DisplayName("Anonymized order ids keep the hash valid")
    void anonymizationKeepsHash() {
        LedgerEntry original = entry();
        LedgerEntry anonymized = original.toBuilder()
                .externalOrderId(EntryHasher.anonymizedForm(original.getExternalOrderId()))
                .internalOrderId(EntryHasher.anonymizedForm(original.getInternalOrderId()))
                .build();

        assertTrue(anonymized.getExternalOrderId().startsWith(EntryHasher.ANONYMIZED_PREFIX));
        assertEquals(EntryHasher.hash(original), EntryHasher.hash(anonymized));
        assertEquals(EntryHasher.orderDigest("ext-1001"), EntryHasher.orderDigest(anonymized.getExternalOrderId()));
    }

    @Test
    @DisplayName("Anonymizing twice is stable")
    void anonymizeIdempotent() {
        String once = EntryHasher.anonymizedForm("ext-1001");
        assertEquals(once, EntryHasher.anonymizedForm(once));
    }
}
