package com.flagship.revenue_ledger.settlement;

import com.flagship.revenue_ledger.baseline.BaselineService;
import com.flagship.revenue_ledger.baseline.BaselineSnapshot;
import com.flagship.revenue_ledger.client.ClientTerms;
import com.flagship.revenue_ledger.client.ClientTermsService;
import com.flagship.revenue_ledger.config.TransactionRunner;
import com.flagship.revenue_ledger.event.InvoiceStatusChangedEvent;
import com.flagship.revenue_ledger.event.SettlementGeneratedEvent;
import com.flagship.revenue_ledger.exception.ConflictException;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.DateRange;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.locking.KeyedLocks;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import com.flagship.revenue_ledger.outbox.OutboxService;
import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import com.flagship.revenue_ledger.uplift.UpliftResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Settlement aggregator: rolls a client's calendar month (UTC) of ledger entries
 * into one invoice.
 *
 * Generation is idempotent per (client, year, month):
 * - an existing invoice is returned unchanged
 * - generation for one key is serialized by an in-process key lock
 * - across instances the {@code uq_invoice_period} constraint lets exactly one
 *   insert win; the loser re-reads and returns the winner's invoice
 *
 * The invoice insert, the stamping of every entry of the period with the invoice id
 * and the outbox event commit in one transaction.
 */
@Service
@Slf4j
public class SettlementService {

    static final String GENERATED_BY = "settlement-aggregator";
    static final BigDecimal HIGH_CONFIDENCE = new BigDecimal("0.85");

    private final SettlementInvoiceRepository repository;
    private final BaselineService baselineService;
    private final ClientTermsService clientTermsService;
    private final LedgerStore ledgerStore;
    private final AdSpendProvider adSpendProvider;
    private final OutboxService outboxService;
    private final TransactionRunner transactionRunner;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final int paymentTermsDays;
    private final KeyedLocks periodLocks = new KeyedLocks("settlement");

    public SettlementService(SettlementInvoiceRepository repository,
                             BaselineService baselineService,
                             ClientTermsService clientTermsService,
                             LedgerStore ledgerStore,
                             AdSpendProvider adSpendProvider,
                             OutboxService outboxService,
                             TransactionRunner transactionRunner,
                             LedgerMetrics metrics,
                             Clock clock,
                             @Value("${ledger.settlement.payment-terms-days:30}") int paymentTermsDays) {
        this.repository = repository;
        this.baselineService = baselineService;
        this.clientTermsService = clientTermsService;
        this.ledgerStore = ledgerStore;
        this.adSpendProvider = adSpendProvider;
        this.outboxService = outboxService;
        this.transactionRunner = transactionRunner;
        this.metrics = metrics;
        this.clock = clock;
        this.paymentTermsDays = paymentTermsDays;
    }

    /**
     * Returns the invoice for the period, generating it on first call.
     *
     * @param timeout caller's budget for the store calls, null for the default
     * @throws ValidationException if the period is malformed or has not ended yet
     * @throws com.flagship.revenue_ledger.exception.BaselineNotFoundException if the client has no baseline
     */
    public SettlementInvoice generateOrReturn(String clientId, int year, int month, Duration timeout) {
        YearMonth period = validatePeriod(clientId, year, month);
        Duration effective = transactionRunner.effectiveTimeout(timeout);
        long startTime = System.currentTimeMillis();

        try (CorrelationContext.Scope ignored = CorrelationContext.forClient(clientId)) {
            Optional<SettlementInvoice> existing = findInvoice(clientId, period, effective);
            if (existing.isPresent()) {
                metrics.recordSettlement("existing");
                log.info("Settlement already generated for {}: invoiceId={}", period, existing.get().getId());
                return existing.get();
            }

            SettlementInvoice invoice = periodLocks.withLock(clientId + ":" + period, effective,
                    () -> generateOnce(clientId, period, effective));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLatency("settle", duration);
            return invoice;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordSettlement("error");
            metrics.recordLatency("settle", duration);
            log.error("Settlement generation failed for client {} {}: error={}, duration={}ms",
                    clientId, period, e.getMessage(), duration);
            throw e;
        }
    }

    public SettlementInvoice getInvoice(UUID invoiceId, Duration timeout) {
        return transactionRunner.readOnly(timeout, () -> repository.findById(invoiceId)
                .map(SettlementInvoiceEntity::toDomain)
                .orElseThrow(() -> new NotFoundException("Invoice " + invoiceId + " not found")));
    }

    /**
     * Entries the invoice was computed from, in append order.
     *
     * @throws NotFoundException if the invoice does not exist
     */
    public List<LedgerEntry> getInvoiceEntries(UUID invoiceId, Duration timeout) {
        return transactionRunner.readOnly(timeout, () -> {
            if (!repository.existsById(invoiceId)) {
                throw new NotFoundException("Invoice " + invoiceId + " not found");
            }
            return ledgerStore.findByInvoice(invoiceId);
        });
    }

    public List<SettlementInvoice> listInvoices(String clientId, Duration timeout) {
        return transactionRunner.readOnly(timeout, () ->
                repository.findByClientIdOrderByBillingYearDescBillingMonthDesc(clientId)
                        .stream()
                        .map(SettlementInvoiceEntity::toDomain)
                        .toList());
    }

    public SettlementInvoice markSent(UUID invoiceId, Duration timeout) {
        return transition(invoiceId, timeout, invoice -> invoice.markSent(clock.instant()));
    }

    public SettlementInvoice markPaid(UUID invoiceId, Duration timeout) {
        return transition(invoiceId, timeout, invoice -> invoice.markPaid(clock.instant()));
    }

    public SettlementInvoice markDisputed(UUID invoiceId, String reason, Duration timeout) {
        return transition(invoiceId, timeout, invoice -> invoice.markDisputed(reason, clock.instant()));
    }

    private SettlementInvoice generateOnce(String clientId, YearMonth period, Duration timeout) {
        try {
            return transactionRunner.inTransaction(timeout, () -> {
                Optional<SettlementInvoice> raced = repository
                        .findByClientIdAndBillingYearAndBillingMonth(clientId, period.getYear(), period.getMonthValue())
                        .map(SettlementInvoiceEntity::toDomain);
                if (raced.isPresent()) {
                    metrics.recordSettlement("existing");
                    return raced.get();
                }
                return create(clientId, period);
            });
        } catch (DataIntegrityViolationException e) {
            // Another instance inserted the invoice between our read and our insert.
            log.warn("Concurrent settlement for {} detected, returning the stored invoice", period);
            return findInvoice(clientId, period, timeout)
                    .orElseThrow(() -> new ConflictException(
                            "Settlement for client " + clientId + " " + period + " could not be generated", e));
        }
    }

    private SettlementInvoice create(String clientId, YearMonth period) {
        BaselineSnapshot baseline = baselineService.getBaseline(clientId);
        ClientTerms terms = clientTermsService.getTerms(clientId);
        DateRange range = DateRange.ofMonth(period);

        List<LedgerEntry> entries = ledgerStore.findAll(clientId, range);
        List<LedgerEntry> attributed = entries.stream().filter(LedgerEntry::isAttributed).toList();
        int highConfidence = (int) attributed.stream()
                .filter(entry -> entry.getAttributionConfidence().compareTo(HIGH_CONFIDENCE) >= 0)
                .count();

        BigDecimal actualRevenue = UpliftCalculator.currency(entries.stream()
                .map(LedgerEntry::getOrderAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add));

        // Without reported spend the period is evaluated on revenue alone, as a single order is.
        Optional<PeriodAdSpend> reportedAdSpend = adSpendProvider.adSpend(clientId, range, baseline);
        BigDecimal actualAdSpend = reportedAdSpend.map(PeriodAdSpend::getActualAdSpend).orElse(UpliftCalculator.ZERO);
        BigDecimal baselineAdSpend = reportedAdSpend.map(PeriodAdSpend::getBaselineAdSpend).orElse(UpliftCalculator.ZERO);
        BigDecimal baselineRevenue = UpliftCalculator.currency(baseline.getBaselineRevenue());

        UpliftResult uplift = UpliftCalculator.perPeriod(
                actualRevenue, baselineRevenue, actualAdSpend, baselineAdSpend, terms.getFeePercentage());
        if (attributed.isEmpty()) {
            uplift = UpliftCalculator.withoutFee(uplift);
        }
        if (uplift.isClamped()) {
            metrics.recordZeroRiskClamp("settlement");
        }
        BigDecimal upliftPercentage = UpliftCalculator.upliftPercentage(uplift.getIncrementalRevenue(), baselineRevenue);

        Instant now = clock.instant();
        UUID invoiceId = UUID.randomUUID();
        CorrelationContext.tagInvoice(invoiceId);

        SettlementInvoice invoice = SettlementInvoice.builder()
                .id(invoiceId)
                .clientId(clientId)
                .platform(baseline.getPlatform())
                .billingYear(period.getYear())
                .billingMonth(period.getMonthValue())
                .baselineRevenue(baselineRevenue)
                .baselineAdSpend(baselineAdSpend)
                .actualRevenue(actualRevenue)
                .actualAdSpend(actualAdSpend)
                .incrementalRevenue(uplift.getIncrementalRevenue())
                .incrementalAdSpend(uplift.getIncrementalAdSpend())
                .netProfitUplift(uplift.getNetProfitUplift())
                .upliftPercentage(upliftPercentage)
                .feePercentage(uplift.getFeePercentage())
                .feeAmount(uplift.getFeeAmount())
                .clientNetGain(uplift.getClientNetGain())
                .clientRoi(uplift.getClientRoi())
                .ordersReviewed(entries.size())
                .ordersAttributed(attributed.size())
                .highConfidenceOrders(highConfidence)
                .status(InvoiceStatus.DRAFT)
                .dueDate(period.atEndOfMonth().plusDays(paymentTermsDays))
                .explanation(InvoiceExplanation.render(period, entries.size(), attributed.size(), highConfidence,
                        actualRevenue, baselineRevenue, upliftPercentage,
                        reportedAdSpend.orElse(null), uplift))
                .generatedBy(GENERATED_BY)
                .createdAt(now)
                .updatedAt(now)
                .build();

        repository.saveAndFlush(SettlementInvoiceEntity.fromDomain(invoice));

        int stamped = ledgerStore.assignInvoiceForPeriod(clientId, range, invoiceId);
        if (stamped != entries.size()) {
            throw new ConflictException(String.format(
                    "Ledger for client %s %s changed during settlement: expected %d entries, stamped %d",
                    clientId, period, entries.size(), stamped));
        }

        outboxService.saveEvent(SettlementGeneratedEvent.fromInvoice(invoice));

        metrics.recordSettlement("created");
        log.info("Settlement generated for {}: invoiceId={}, orders={}, attributed={}, netProfitUplift={}, fee={}",
                period, invoiceId, entries.size(), attributed.size(),
                invoice.getNetProfitUplift(), invoice.getFeeAmount());
        return invoice;
    }

    private SettlementInvoice transition(UUID invoiceId, Duration timeout, UnaryOperator<SettlementInvoice> step) {
        try (CorrelationContext.Scope ignored = CorrelationContext.forInvoice(invoiceId)) {
            return transactionRunner.inTransaction(timeout, () -> {
                SettlementInvoiceEntity entity = repository.findById(invoiceId)
                        .orElseThrow(() -> new NotFoundException("Invoice " + invoiceId + " not found"));
                SettlementInvoice current = entity.toDomain();
                SettlementInvoice next = step.apply(current);
                if (next == current) {
                    log.info("Invoice already {}, nothing to do", current.getStatus());
                    return current;
                }

                entity.applyStatus(next);
                repository.saveAndFlush(entity);
                outboxService.saveEvent(InvoiceStatusChangedEvent.of(next, current.getStatus()));

                metrics.recordInvoiceTransition(next.getStatus().name());
                log.info("Invoice status changed: {} -> {}", current.getStatus(), next.getStatus());
                return next;
            });
        }
    }

    private Optional<SettlementInvoice> findInvoice(String clientId, YearMonth period, Duration timeout) {
        return transactionRunner.readOnly(timeout, () -> repository
                .findByClientIdAndBillingYearAndBillingMonth(clientId, period.getYear(), period.getMonthValue())
                .map(SettlementInvoiceEntity::toDomain));
    }

    private YearMonth validatePeriod(String clientId, int year, int month) {
        if (clientId == null || clientId.isBlank()) {
            throw new ValidationException("clientId", "Client id is required");
        }
        if (month < 1 || month > 12) {
            throw new ValidationException("month", "Month must be between 1 and 12");
        }
        if (year < 2000 || year > 9999) {
            throw new ValidationException("year", "Year must be between 2000 and 9999");
        }
        YearMonth period = YearMonth.of(year, month);
        YearMonth current = YearMonth.from(clock.instant().atZone(ZoneOffset.UTC));
        if (!period.isBefore(current)) {
            throw new ValidationException("month", "Billing period " + period + " has not ended yet");
        }
        return period;
    }
}
