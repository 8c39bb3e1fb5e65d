package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.attribution.Agent;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * SHA-256 hash chain over ledger entries.
 *
 * Each entry's hash covers its predecessor's hash (per client, {@link #GENESIS_HASH}
 * for the first entry), its financial fields, its creation time and a digest of the
 * external order id. The order id itself is never hashed, so anonymizing an entry
 * keeps the chain verifiable.
 */
public final class EntryHasher {

    public static final String GENESIS_HASH = "0".repeat(64);
    public static final String ANONYMIZED_PREFIX = "anon:";

    private static final String FORMAT_VERSION = "v1";
    private static final char SEPARATOR = '|';

    private EntryHasher() {
    }

    public static String hash(LedgerEntry entry) {
        return sha256Hex(canonicalForm(entry));
    }

    /**
     * Digest identifying an order without revealing it. For an anonymized id the
     * digest is recovered from the stored form.
     */
    public static String orderDigest(String orderId) {
        if (orderId.startsWith(ANONYMIZED_PREFIX)) {
            return orderId.substring(ANONYMIZED_PREFIX.length());
        }
        return sha256Hex(orderId);
    }

    public static String anonymizedForm(String orderId) {
        return ANONYMIZED_PREFIX + orderDigest(orderId);
    }

    static String canonicalForm(LedgerEntry entry) {
        StringBuilder sb = new StringBuilder(512);
        append(sb, FORMAT_VERSION);
        append(sb, entry.getPreviousHash());
        append(sb, entry.getClientId());
        append(sb, entry.getPlatform());
        append(sb, orderDigest(entry.getExternalOrderId()));
        append(sb, money(entry.getOrderAmount()));
        append(sb, Boolean.toString(entry.isAttributed()));
        append(sb, entry.getAttributionConfidence().setScale(4, RoundingMode.HALF_EVEN).toPlainString());
        append(sb, money(entry.getBaselineRevenue()));
        append(sb, money(entry.getIncrementalRevenue()));
        append(sb, money(entry.getUpliftPercentage()));
        append(sb, entry.getAdSpendForOrder() == null ? "" : money(entry.getAdSpendForOrder()));
        append(sb, money(entry.getBaselineAdSpend()));
        append(sb, money(entry.getIncrementalAdSpend()));
        append(sb, money(entry.getNetProfitUplift()));
        append(sb, money(entry.getFeeAmount()));
        append(sb, Boolean.toString(entry.isFeeApplicable()));
        append(sb, entry.getContributingAgents().stream().map(Agent::name).collect(Collectors.joining(",")));
        append(sb, nullToEmpty(entry.getCampaignId()));
        append(sb, nullToEmpty(entry.getCreativeId()));
        append(sb, entry.getExplanation());
        sb.append(entry.getCreatedAt().toEpochMilli());
        return sb.toString();
    }

    private static void append(StringBuilder sb, String value) {
        sb.append(value).append(SEPARATOR);
    }

    private static String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    static String sha256Hex(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
