package com.flagship.revenue_ledger.order;

import com.flagship.revenue_ledger.attribution.AttributionDecision;
import com.flagship.revenue_ledger.attribution.AttributionDecisionEngine;
import com.flagship.revenue_ledger.attribution.AttributionInput;
import com.flagship.revenue_ledger.attribution.AttributionOutcome;
import com.flagship.revenue_ledger.attribution.SignalScores;
import com.flagship.revenue_ledger.baseline.BaselineDelta;
import com.flagship.revenue_ledger.baseline.BaselineService;
import com.flagship.revenue_ledger.baseline.BaselineSnapshot;
import com.flagship.revenue_ledger.client.ClientTerms;
import com.flagship.revenue_ledger.client.ClientTermsService;
import com.flagship.revenue_ledger.config.TransactionRunner;
import com.flagship.revenue_ledger.event.OrderAttributedEvent;
import com.flagship.revenue_ledger.exception.DuplicateOrderException;
import com.flagship.revenue_ledger.exception.LedgerPersistenceException;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.AttributionLog;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.locking.KeyedLocks;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import com.flagship.revenue_ledger.order.dto.AttributionResult;
import com.flagship.revenue_ledger.order.dto.OrderAttributionResponse;
import com.flagship.revenue_ledger.order.dto.RecordOrderRequest;
import com.flagship.revenue_ledger.outbox.OutboxService;
import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * RecordOrder: evaluates one order and records the decision.
 *
 * Per order, in one transaction bounded by the caller's timeout:
 * 1. read the client's baseline (with its row version) and terms
 * 2. run the attribution decision engine
 * 3. append the ledger entry and its attribution log
 * 4. add the order to the baseline's running totals, guarded by the row version
 * 5. write the OrderAttributed event to the outbox
 *
 * Orders of one client are serialized by an in-process lock; across instances the
 * baseline row version and the ledger's unique keys catch races, and the
 * transaction is retried a bounded number of times. A duplicate submission, however
 * it races, is answered with the original entry.
 */
@Service
@Slf4j
public class OrderAttributionService {

    static final String DECISION_ENGINE = "attribution-decision-engine";
    static final String ATTRIBUTED_BY = "revenue-ledger";

    private final AttributionDecisionEngine decisionEngine;
    private final BaselineService baselineService;
    private final ClientTermsService clientTermsService;
    private final LedgerStore ledgerStore;
    private final OutboxService outboxService;
    private final IdempotencyService idempotencyService;
    private final TransactionRunner transactionRunner;
    private final LedgerMetrics metrics;
    private final Validator validator;
    private final Clock clock;
    private final int maxAttempts;
    private final KeyedLocks clientLocks = new KeyedLocks("client");

    public OrderAttributionService(AttributionDecisionEngine decisionEngine,
                                   BaselineService baselineService,
                                   ClientTermsService clientTermsService,
                                   LedgerStore ledgerStore,
                                   OutboxService outboxService,
                                   IdempotencyService idempotencyService,
                                   TransactionRunner transactionRunner,
                                   LedgerMetrics metrics,
                                   Validator validator,
                                   Clock clock,
                                   @Value("${ledger.append.max-attempts:3}") int maxAttempts) {
        this.decisionEngine = decisionEngine;
        this.baselineService = baselineService;
        this.clientTermsService = clientTermsService;
        this.ledgerStore = ledgerStore;
        this.outboxService = outboxService;
        this.idempotencyService = idempotencyService;
        this.transactionRunner = transactionRunner;
        this.metrics = metrics;
        this.validator = validator;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Records an order. Idempotent on {@code (clientId, externalOrderId)}.
     *
     * @param timeout caller's budget for store calls and lock waits, null for the default
     * @return the stored entry; {@code duplicate} is set when it was recorded earlier
     * @throws ValidationException on malformed input
     * @throws com.flagship.revenue_ledger.exception.BaselineNotFoundException if the client has no baseline yet
     * @throws LedgerPersistenceException if storage failed or timed out; retry with the same order id
     */
    public AttributionResult recordOrder(RecordOrderRequest request, Duration timeout) {
        SignalScores scores = validate(request);
        Duration effective = transactionRunner.effectiveTimeout(timeout);
        long startTime = System.currentTimeMillis();

        try (CorrelationContext.Scope ignored = CorrelationContext.forClient(request.getClientId())) {
            log.info("Recording order: externalOrderId={}, amount={}, confidence={}",
                    request.getExternalOrderId(), request.getOrderAmount(), request.getAttributionConfidence());

            Optional<LedgerEntry> existing = transactionRunner.readOnly(effective, () ->
                    idempotencyService.findExisting(request.getClientId(), request.getExternalOrderId()));
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                metrics.recordOrder("duplicate");
                CorrelationContext.tagEntry(existing.get().getEntryHash());
                log.warn("Order already recorded, returning the original entry: externalOrderId={}",
                        request.getExternalOrderId());
                return AttributionResult.from(existing.get(), true);
            }
            metrics.recordIdempotencyMiss();

            Recorded recorded = clientLocks.withLock(request.getClientId(), effective,
                    () -> appendWithRetry(request, scores, effective));
            LedgerEntry entry = recorded.entry();
            CorrelationContext.tagEntry(entry.getEntryHash());

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordLatency("record_order", duration);
            if (recorded.duplicate()) {
                metrics.recordOrder("duplicate");
                log.warn("Order was recorded concurrently, returning the original entry: externalOrderId={}",
                        request.getExternalOrderId());
            } else {
                metrics.recordOrder(recorded.outcome().name());
                metrics.recordFeeCharged(entry.getFeeAmount());
                if (recorded.zeroRiskClamped()) {
                    metrics.recordZeroRiskClamp("order");
                }
                idempotencyService.remember(entry);
                log.info("Order recorded: sequence={}, attributed={}, netProfitUplift={}, fee={}, duration={}ms",
                        entry.getSequence(), entry.isAttributed(), entry.getNetProfitUplift(),
                        entry.getFeeAmount(), duration);
            }
            return AttributionResult.from(entry, recorded.duplicate());

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOrder("error");
            metrics.recordLatency("record_order", duration);
            log.error("Order recording failed: clientId={}, externalOrderId={}, error={}, duration={}ms",
                    request.getClientId(), request.getExternalOrderId(), e.getMessage(), duration);
            throw e;
        }
    }

    /**
     * The entry recorded for an order and the attribution log explaining it.
     */
    public OrderAttributionResponse getOrderAttribution(String clientId, String externalOrderId, Duration timeout) {
        return transactionRunner.readOnly(timeout, () -> {
            LedgerEntry entry = ledgerStore.findByOrder(clientId, externalOrderId)
                    .orElseThrow(() -> new NotFoundException(
                            "Order " + externalOrderId + " not found for client " + clientId));
            AttributionLog attributionLog = ledgerStore.findAttributionLog(entry.getSequence())
                    .orElseThrow(() -> new IllegalStateException(
                            "Ledger entry " + entry.getEntryHash() + " has no attribution log"));
            return OrderAttributionResponse.builder()
                    .entry(AttributionResult.from(entry))
                    .attributionLog(OrderAttributionResponse.LogDetail.from(attributionLog))
                    .build();
        });
    }

    /**
     * Scrubs the order identifiers of an entry. Figures and hash are kept.
     */
    public AttributionResult anonymize(String clientId, String externalOrderId, Duration timeout) {
        try (CorrelationContext.Scope ignored = CorrelationContext.forClient(clientId)) {
            LedgerEntry entry = transactionRunner.inTransaction(timeout,
                    () -> ledgerStore.anonymize(clientId, externalOrderId));
            CorrelationContext.tagEntry(entry.getEntryHash());
            log.info("Order anonymized: sequence={}", entry.getSequence());
            return AttributionResult.from(entry);
        }
    }

    private Recorded appendWithRetry(RecordOrderRequest request, SignalScores scores, Duration timeout) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionRunner.inTransaction(timeout, () -> recordInTransaction(request, scores));

            } catch (DuplicateOrderException | DataIntegrityViolationException e) {
                Optional<LedgerEntry> winner = transactionRunner.readOnly(timeout,
                        () -> ledgerStore.findByOrder(request.getClientId(), request.getExternalOrderId()));
                if (winner.isPresent()) {
                    return Recorded.duplicateOf(winner.get());
                }
                // Lost the race for the head of the hash chain to another instance.
                lastFailure = e;
            } catch (ConcurrencyFailureException e) {
                lastFailure = e;
            }
            metrics.recordAppendRetry();
            log.warn("Concurrent write for client, retrying: attempt={}/{}, error={}",
                    attempt, maxAttempts, lastFailure.getMessage());
        }
        throw new LedgerPersistenceException("Could not record order " + request.getExternalOrderId()
                + " after " + maxAttempts + " attempts due to concurrent writes", lastFailure);
    }

    private Recorded recordInTransaction(RecordOrderRequest request, SignalScores scores) {
        String clientId = request.getClientId();
        BaselineSnapshot baseline = baselineService.getBaseline(clientId);
        ClientTerms terms = clientTermsService.getTerms(clientId);

        AttributionDecision decision = decisionEngine.decide(AttributionInput.builder()
                .orderAmount(request.getOrderAmount().setScale(UpliftCalculator.CURRENCY_SCALE, RoundingMode.UNNECESSARY))
                .baselineAvgOrderValue(baseline.getBaselineAvgOrderValue())
                .confidence(request.getAttributionConfidence().setScale(SignalScores.SCORE_SCALE, RoundingMode.UNNECESSARY))
                .confidenceThreshold(terms.getConfidenceThreshold())
                .signalScores(scores)
                .feePercentage(terms.getFeePercentage())
                .adSpendForOrder(request.getAdSpendForOrder() == null ? null
                        : UpliftCalculator.currency(request.getAdSpendForOrder()))
                .baselineAdSpendPerOrder(baseline.adSpendPerOrder())
                .build());

        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        LedgerEntry entry = LedgerEntry.builder()
                .clientId(clientId)
                .platform(request.getPlatform() == null || request.getPlatform().isBlank()
                        ? baseline.getPlatform() : request.getPlatform())
                .internalOrderId(request.getInternalOrderId())
                .externalOrderId(request.getExternalOrderId())
                .orderAmount(decision.getOrderAmount())
                .attributed(decision.isAttributed())
                .attributionConfidence(decision.getConfidence())
                .baselineRevenue(decision.getBaselineRevenue())
                .incrementalRevenue(decision.getIncrementalRevenue())
                .upliftPercentage(decision.getUpliftPercentage())
                .adSpendForOrder(decision.getAdSpendForOrder())
                .baselineAdSpend(decision.getBaselineAdSpend())
                .incrementalAdSpend(decision.getIncrementalAdSpend())
                .netProfitUplift(decision.getNetProfitUplift())
                .feeAmount(decision.getFeeAmount())
                .feeApplicable(decision.isFeeApplicable())
                .contributingAgents(decision.getAgents())
                .explanation(decision.getExplanation())
                .campaignId(request.getCampaignId())
                .creativeId(request.getCreativeId())
                .touchpointId(request.getTouchpointId())
                .createdAt(now)
                .build();

        AttributionLog attributionLog = AttributionLog.builder()
                .clientId(clientId)
                .decisionEngine(DECISION_ENGINE)
                .signalScores(decision.getSignalScores())
                .finalConfidence(decision.getConfidence())
                .thresholdApplied(decision.getThresholdApplied())
                .agentShares(decision.getAgentShares())
                .counterfactualRevenue(decision.getCounterfactualRevenue())
                .explanation(decision.getExplanation())
                .attributedBy(ATTRIBUTED_BY)
                .createdAt(now)
                .build();

        LedgerEntry stored = ledgerStore.append(entry, attributionLog);
        baselineService.applyCurrentPeriodDelta(clientId, baseline.getVersion(), deltaFor(decision));
        outboxService.saveEvent(OrderAttributedEvent.fromEntry(stored));
        return new Recorded(stored, false, decision.getOutcome(), decision.isZeroRiskClamped());
    }

    private static BaselineDelta deltaFor(AttributionDecision decision) {
        BaselineDelta.BaselineDeltaBuilder delta = BaselineDelta.builder()
                .revenue(decision.getOrderAmount())
                .adSpend(decision.getAdSpendForOrder() == null ? UpliftCalculator.ZERO : decision.getAdSpendForOrder())
                .orders(1);
        if (decision.isAttributed()) {
            delta.incrementalRevenue(decision.getIncrementalRevenue())
                    .incrementalAdSpend(decision.getIncrementalAdSpend())
                    .netProfitUplift(decision.getNetProfitUplift())
                    .fees(decision.getFeeAmount());
        }
        return delta.build();
    }

    private SignalScores validate(RecordOrderRequest request) {
        if (request == null) {
            throw new ValidationException("Order event is required");
        }
        Set<ConstraintViolation<RecordOrderRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            Map<String, String> errors = new TreeMap<>();
            for (ConstraintViolation<RecordOrderRequest> violation : violations) {
                errors.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage());
            }
            throw new ValidationException("Order validation failed", errors);
        }
        return SignalScores.fromWire(request.getSignalScores());
    }

    private record Recorded(LedgerEntry entry, boolean duplicate, AttributionOutcome outcome, boolean zeroRiskClamped) {

        static Recorded duplicateOf(LedgerEntry entry) {
            return new Recorded(entry, true, null, false);
        }
    }
}
