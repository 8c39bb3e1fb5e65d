package com.flagship.revenue_ledger.observability;

import org.slf4j.MDC;

import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * MDC keys shared by every ledger log line, and the correlation id that ties an
 * HTTP request or order event to the outbox events it produced.
 *
 * The correlation id lives in MDC only. Client, entry and invoice keys are bound
 * through {@link Scope}s so that a service method cannot leak them into the next
 * request served by the same thread.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String CLIENT_ID_MDC_KEY = "clientId";
    public static final String ENTRY_HASH_MDC_KEY = "entryHash";
    public static final String INVOICE_ID_MDC_KEY = "invoiceId";

    private static final List<String> LEDGER_KEYS = List.of(CLIENT_ID_MDC_KEY, ENTRY_HASH_MDC_KEY, INVOICE_ID_MDC_KEY);

    // Caller supplied ids end up in log lines and outbox rows.
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    private CorrelationContext() {
    }

    /**
     * Starts a unit of work, adopting the caller's id when it is usable.
     *
     * @return the correlation id now in MDC
     */
    public static String begin(String incomingId) {
        String id = incomingId != null && ACCEPTED_ID.matcher(incomingId).matches()
                ? incomingId
                : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * @return the id of the current unit of work, or null outside one
     */
    public static String current() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static Scope forClient(String clientId) {
        MDC.put(CLIENT_ID_MDC_KEY, clientId);
        return () -> {
            MDC.remove(CLIENT_ID_MDC_KEY);
            MDC.remove(ENTRY_HASH_MDC_KEY);
            MDC.remove(INVOICE_ID_MDC_KEY);
        };
    }

    public static Scope forInvoice(UUID invoiceId) {
        MDC.put(INVOICE_ID_MDC_KEY, invoiceId.toString());
        return () -> MDC.remove(INVOICE_ID_MDC_KEY);
    }

    /** Tags the rest of the enclosing client scope with an entry hash. */
    public static void tagEntry(String entryHash) {
        MDC.put(ENTRY_HASH_MDC_KEY, entryHash);
    }

    /** Tags the rest of the enclosing client scope with an invoice id. */
    public static void tagInvoice(UUID invoiceId) {
        MDC.put(INVOICE_ID_MDC_KEY, invoiceId.toString());
    }

    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        LEDGER_KEYS.forEach(MDC::remove);
    }

    /**
     * Short form for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Removes the keys it bound. Never throws.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
