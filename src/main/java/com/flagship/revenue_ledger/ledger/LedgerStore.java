package com.flagship.revenue_ledger.ledger;

import com.flagship.revenue_ledger.attribution.Agent;
import com.flagship.revenue_ledger.exception.ConflictException;
import com.flagship.revenue_ledger.exception.DuplicateOrderException;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable ledger store.
 *
 * Entries are appended, never updated or deleted, with two exceptions that are both
 * one-way and enforced with conditional SQL ({@code ... WHERE invoice_id IS NULL},
 * {@code ... WHERE anonymized_at IS NULL}):
 * - {@link #assignInvoice}: sets the invoice id exactly once
 * - {@link #anonymize}: replaces order identifiers with their digests, keeps every
 *   financial field and the entry hash
 *
 * {@code (client_id, external_order_id)} is unique, which makes duplicate order
 * submissions safe however they race. {@code (client_id, previous_hash)} is unique
 * too, so two writers can never fork a client's hash chain.
 */
@Service
@Slf4j
public class LedgerStore {

    public static final int MAX_PAGE_SIZE = 1000;

    private static final String ASSIGN_INVOICE_SQL =
        "UPDATE ledger_entries SET invoice_id = ? WHERE entry_hash = ? AND invoice_id IS NULL";

    private static final String ASSIGN_PERIOD_SQL = """
        UPDATE ledger_entries SET invoice_id = ?
         WHERE client_id = ? AND created_at >= ? AND created_at < ? AND invoice_id IS NULL
        """;

    private static final String ANONYMIZE_SQL = """
        UPDATE ledger_entries
           SET internal_order_id = ?, external_order_id = ?, touchpoint_id = NULL, anonymized_at = ?
         WHERE id = ? AND anonymized_at IS NULL
        """;

    private final LedgerEntryRepository entryRepository;
    private final AttributionLogRepository logRepository;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    public LedgerStore(LedgerEntryRepository entryRepository,
                       AttributionLogRepository logRepository,
                       JdbcTemplate jdbcTemplate,
                       Clock clock) {
        this.entryRepository = entryRepository;
        this.logRepository = logRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Appends an entry and its attribution log atomically.
     *
     * The entry is linked to the head of the client's chain and hashed here; any
     * {@code entryHash}/{@code previousHash} on the argument is ignored.
     *
     * @return the stored entry, carrying its sequence and hash
     * @throws DuplicateOrderException if the order is already recorded for the client,
     *         with the existing entry's identifiers
     */
    @Transactional
    public LedgerEntry append(LedgerEntry entry, AttributionLog attributionLog) {
        Optional<LedgerEntryEntity> existing = findOrderEntity(entry.getClientId(), entry.getExternalOrderId());
        if (existing.isPresent()) {
            LedgerEntryEntity found = existing.get();
            throw new DuplicateOrderException(entry.getClientId(), entry.getExternalOrderId(),
                    found.getEntryHash(), found.getId());
        }

        String previousHash = latestHash(entry.getClientId());
        LedgerEntry chained = entry.toBuilder()
                .sequence(null)
                .previousHash(previousHash)
                .entryHash(null)
                .invoiceId(null)
                .anonymizedAt(null)
                .build();
        LedgerEntry hashed = chained.toBuilder().entryHash(EntryHasher.hash(chained)).build();

        LedgerEntryEntity saved = entryRepository.saveAndFlush(LedgerEntryEntity.fromDomain(hashed));
        logRepository.saveAndFlush(AttributionLogEntity.fromDomain(attributionLog, saved.getId()));

        log.debug("Appended ledger entry: clientId={}, sequence={}, hash={}, previous={}",
                saved.getClientId(), saved.getId(), saved.getEntryHash(), previousHash);
        return saved.toDomain();
    }

    /**
     * Hash of the client's most recent entry, or {@link EntryHasher#GENESIS_HASH}.
     */
    @Transactional(readOnly = true)
    public String latestHash(String clientId) {
        return entryRepository.findFirstByClientIdOrderByIdDesc(clientId)
                .map(LedgerEntryEntity::getEntryHash)
                .orElse(EntryHasher.GENESIS_HASH);
    }

    /**
     * Sets the entry's invoice id. Allowed exactly once.
     *
     * @throws NotFoundException if no entry has this hash
     * @throws ConflictException if the entry already belongs to an invoice
     */
    @Transactional
    public void assignInvoice(String entryHash, UUID invoiceId) {
        int updated = jdbcTemplate.update(ASSIGN_INVOICE_SQL, invoiceId, entryHash);
        if (updated == 1) {
            log.debug("Assigned entry {} to invoice {}", entryHash, invoiceId);
            return;
        }
        LedgerEntryEntity entity = entryRepository.findByEntryHash(entryHash)
                .orElseThrow(() -> new NotFoundException("Ledger entry " + entryHash + " not found"));
        throw new ConflictException("Ledger entry " + entryHash
                + " is already assigned to invoice " + currentInvoice(entity.getId()));
    }

    /**
     * Stamps every not-yet-invoiced entry of the client in {@code range}.
     *
     * @return number of entries stamped
     */
    @Transactional
    public int assignInvoiceForPeriod(String clientId, DateRange range, UUID invoiceId) {
        int updated = jdbcTemplate.update(ASSIGN_PERIOD_SQL,
                invoiceId, clientId, range.getFrom().atOffset(ZoneOffset.UTC), range.getTo().atOffset(ZoneOffset.UTC));
        log.debug("Assigned {} entries of client {} to invoice {}", updated, clientId, invoiceId);
        return updated;
    }

    /**
     * One page of a client's entries within {@code range}, in append order.
     *
     * @param afterSequence last sequence already seen, or null to start from the beginning
     */
    @Transactional(readOnly = true)
    public LedgerPage query(String clientId, DateRange range, Long afterSequence, int limit) {
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException("limit", "Limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        long after = afterSequence == null ? 0L : afterSequence;

        // One extra row tells us whether another page exists.
        List<LedgerEntry> rows = entryRepository.findPage(clientId, range.getFrom(), range.getTo(), after,
                        PageRequest.of(0, limit + 1))
                .stream()
                .map(LedgerEntryEntity::toDomain)
                .toList();

        if (rows.size() <= limit) {
            return new LedgerPage(rows, null);
        }
        List<LedgerEntry> page = rows.subList(0, limit);
        return new LedgerPage(List.copyOf(page), page.get(limit - 1).getSequence());
    }

    /**
     * Every entry of the client in {@code range}, in append order.
     */
    @Transactional(readOnly = true)
    public List<LedgerEntry> findAll(String clientId, DateRange range) {
        List<LedgerEntry> all = new ArrayList<>();
        Long cursor = null;
        LedgerPage page;
        do {
            page = query(clientId, range, cursor, MAX_PAGE_SIZE);
            all.addAll(page.getEntries());
            cursor = page.getNextCursor();
        } while (page.hasMore());
        return all;
    }

    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findByHash(String entryHash) {
        return entryRepository.findByEntryHash(entryHash).map(LedgerEntryEntity::toDomain);
    }

    /**
     * Looks up an order by its external id. Also finds the entry after anonymization.
     */
    @Transactional(readOnly = true)
    public Optional<LedgerEntry> findByOrder(String clientId, String externalOrderId) {
        return findOrderEntity(clientId, externalOrderId).map(LedgerEntryEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<AttributionLog> findAttributionLog(long sequence) {
        return logRepository.findByLedgerEntryId(sequence).map(AttributionLogEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findRecentAttributed(String clientId, int limit) {
        return entryRepository.findRecentAttributed(clientId, PageRequest.of(0, limit))
                .stream()
                .map(LedgerEntryEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<LedgerEntry> findByInvoice(UUID invoiceId) {
        return entryRepository.findByInvoiceIdOrderByIdAsc(invoiceId)
                .stream()
                .map(LedgerEntryEntity::toDomain)
                .toList();
    }

    /**
     * Replaces the order identifiers with their digests and clears the touchpoint
     * reference. Financial fields, the hash and the chain are untouched. Repeating
     * the call is a no-op.
     *
     * @throws NotFoundException if the order was never recorded for the client
     */
    @Transactional
    public LedgerEntry anonymize(String clientId, String externalOrderId) {
        LedgerEntryEntity entity = findOrderEntity(clientId, externalOrderId)
                .orElseThrow(() -> new NotFoundException(
                        "Order " + externalOrderId + " not found for client " + clientId));
        if (entity.getAnonymizedAt() != null) {
            return entity.toDomain();
        }

        int updated = jdbcTemplate.update(ANONYMIZE_SQL,
                EntryHasher.anonymizedForm(entity.getInternalOrderId()),
                EntryHasher.anonymizedForm(entity.getExternalOrderId()),
                clock.instant().atOffset(ZoneOffset.UTC),
                entity.getId());
        entityManager.refresh(entity);

        if (updated == 1) {
            log.info("Anonymized ledger entry: clientId={}, sequence={}, hash={}",
                    clientId, entity.getId(), entity.getEntryHash());
        }
        return entity.toDomain();
    }

    /**
     * Ad spend reported on the client's entries in {@code range}, with the per-order
     * baseline spend of exactly those entries.
     */
    @Transactional(readOnly = true)
    public ReportedAdSpend sumReportedAdSpend(String clientId, DateRange range) {
        return entryRepository.sumReportedAdSpend(clientId, range.getFrom(), range.getTo());
    }

    /**
     * Summed agent shares over the client's attributed entries.
     */
    @Transactional(readOnly = true)
    public Map<Agent, BigDecimal> agentShareTotals(String clientId) {
        BigDecimal[] totals = logRepository.agentShareTotals(clientId);
        Map<Agent, BigDecimal> shares = new EnumMap<>(Agent.class);
        shares.put(Agent.BID_OPTIMIZER, totals[0]);
        shares.put(Agent.LTV_TARGETING, totals[1]);
        shares.put(Agent.CREATIVE_STUDIO, totals[2]);
        shares.put(Agent.NURTURE_FLOWS, totals[3]);
        return shares;
    }

    @Transactional(readOnly = true)
    public long countEntries(String clientId) {
        return entryRepository.countByClientId(clientId);
    }

    @Transactional(readOnly = true)
    public long countAttributed(String clientId) {
        return entryRepository.countByClientIdAndAttributedTrue(clientId);
    }

    private Optional<LedgerEntryEntity> findOrderEntity(String clientId, String externalOrderId) {
        Optional<LedgerEntryEntity> direct = entryRepository.findByClientIdAndExternalOrderId(clientId, externalOrderId);
        if (direct.isPresent() || externalOrderId.startsWith(EntryHasher.ANONYMIZED_PREFIX)) {
            return direct;
        }
        return entryRepository.findByClientIdAndExternalOrderId(clientId,
                EntryHasher.anonymizedForm(externalOrderId));
    }

    private UUID currentInvoice(long id) {
        return jdbcTemplate.queryForObject(
                "SELECT invoice_id FROM ledger_entries WHERE id = ?", UUID.class, id);
    }
}
