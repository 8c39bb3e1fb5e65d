package com.flagship.revenue_ledger.audit;

import com.flagship.revenue_ledger.config.TransactionRunner;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.DateRange;
import com.flagship.revenue_ledger.ledger.EntryHasher;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerPage;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Read-only export of a client's ledger for external hash-chain verification.
 *
 * Entries are read a page at a time, each page in its own read-only transaction,
 * in append order. Nothing here writes to any store.
 */
@Service
@Slf4j
public class AuditExportService {

    static final int PAGE_SIZE = 500;
    static final String CSV_HEADER =
        "EntryHash,PreviousHash,Sequence,OrderDigest,OrderID,OrderAmount,Attributed,"
            + "IncrementalRevenue,NetProfitUplift,FeeAmount,Confidence,Timestamp";

    private final LedgerStore ledgerStore;
    private final TransactionRunner transactionRunner;

    public AuditExportService(LedgerStore ledgerStore, TransactionRunner transactionRunner) {
        this.ledgerStore = ledgerStore;
        this.transactionRunner = transactionRunner;
    }

    public List<AuditRecord> export(String clientId, DateRange range, Duration timeout) {
        List<AuditRecord> records = new ArrayList<>();
        forEachEntry(clientId, range, timeout, entry -> records.add(AuditRecord.from(entry)));
        log.info("Audit export: clientId={}, records={}", clientId, records.size());
        return records;
    }

    /**
     * Writes the export as CSV with a header row.
     *
     * @return number of data rows written
     */
    public long exportCsv(String clientId, DateRange range, Writer out, Duration timeout) {
        long[] rows = {0};
        write(out, CSV_HEADER);
        forEachEntry(clientId, range, timeout, entry -> {
            write(out, toCsvRow(AuditRecord.from(entry)));
            rows[0]++;
        });
        try {
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to flush audit export", e);
        }
        log.info("Audit CSV export: clientId={}, rows={}", clientId, rows[0]);
        return rows[0];
    }

    /**
     * Recomputes every hash in the range and checks that each entry links to its
     * predecessor. The first entry of a partial range is anchored on its stored
     * predecessor, which must exist for the client.
     */
    public VerificationReport verify(String clientId, DateRange range, Duration timeout) {
        ChainCheck check = new ChainCheck(clientId, range, timeout);
        forEachEntry(clientId, range, timeout, check);
        VerificationReport report = check.report();
        if (report.isValid()) {
            log.info("Audit trail verified: clientId={}, entries={}", clientId, report.getEntriesChecked());
        } else {
            log.warn("Audit trail broken: clientId={}, sequence={}, reason={}",
                    clientId, report.getBrokenSequence(), report.getReason());
        }
        return report;
    }

    private void forEachEntry(String clientId, DateRange range, Duration timeout, Consumer<LedgerEntry> sink) {
        if (clientId == null || clientId.isBlank()) {
            throw new ValidationException("clientId", "Client id is required");
        }
        Long cursor = null;
        LedgerPage page;
        do {
            Long after = cursor;
            page = transactionRunner.readOnly(timeout, () -> ledgerStore.query(clientId, range, after, PAGE_SIZE));
            page.getEntries().forEach(sink);
            cursor = page.getNextCursor();
        } while (page.hasMore());
    }

    static String toCsvRow(AuditRecord record) {
        return String.join(",",
                record.getEntryHash(),
                record.getPreviousHash(),
                Long.toString(record.getSequence()),
                record.getOrderDigest(),
                escape(record.getOrderId()),
                plain(record.getOrderAmount()),
                Boolean.toString(record.isAttributed()),
                plain(record.getIncrementalRevenue()),
                plain(record.getNetProfitUplift()),
                plain(record.getFeeAmount()),
                plain(record.getConfidence()),
                record.getTimestamp().toString());
    }

    /**
     * RFC 4180 quoting for free-text fields.
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static String plain(BigDecimal value) {
        return value == null ? "" : value.toPlainString();
    }

    private static void write(Writer out, String line) {
        try {
            out.write(line);
            out.write("\r\n");
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit export", e);
        }
    }

    /**
     * Walks entries in append order, remembering the first failure.
     */
    private final class ChainCheck implements Consumer<LedgerEntry> {

        private final String clientId;
        private final DateRange range;
        private final Duration timeout;
        private String expectedPrevious;
        private long checked;
        private Long brokenSequence;
        private String brokenHash;
        private String reason;

        ChainCheck(String clientId, DateRange range, Duration timeout) {
            this.clientId = clientId;
            this.range = range;
            this.timeout = timeout;
        }

        @Override
        public void accept(LedgerEntry entry) {
            if (reason != null) {
                return;
            }
            checked++;

            if (expectedPrevious == null) {
                expectedPrevious = anchorFor(entry);
            }
            if (!entry.getPreviousHash().equals(expectedPrevious)) {
                fail(entry, "previous hash " + entry.getPreviousHash() + " does not match " + expectedPrevious);
                return;
            }
            String recomputed = EntryHasher.hash(entry);
            if (!recomputed.equals(entry.getEntryHash())) {
                fail(entry, "stored hash does not match recomputed hash " + recomputed);
                return;
            }
            expectedPrevious = entry.getEntryHash();
        }

        private String anchorFor(LedgerEntry first) {
            String previous = first.getPreviousHash();
            if (EntryHasher.GENESIS_HASH.equals(previous)) {
                return previous;
            }
            Optional<LedgerEntry> predecessor = transactionRunner.readOnly(timeout,
                    () -> ledgerStore.findByHash(previous));
            boolean linked = predecessor.isPresent()
                    && predecessor.get().getClientId().equals(clientId)
                    && predecessor.get().getSequence() < first.getSequence();
            return linked ? previous : "missing predecessor";
        }

        private void fail(LedgerEntry entry, String why) {
            brokenSequence = entry.getSequence();
            brokenHash = entry.getEntryHash();
            reason = why;
        }

        VerificationReport report() {
            return VerificationReport.builder()
                    .clientId(clientId)
                    .from(range.getFrom())
                    .to(range.getTo())
                    .entriesChecked(checked)
                    .valid(reason == null)
                    .lastHash(reason == null ? expectedPrevious : null)
                    .brokenSequence(brokenSequence)
                    .brokenEntryHash(brokenHash)
                    .reason(reason)
                    .build();
        }
    }
}
