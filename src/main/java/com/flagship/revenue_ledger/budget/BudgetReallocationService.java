package com.flagship.revenue_ledger.budget;

import com.flagship.revenue_ledger.budget.dto.BudgetReallocationRequest;
import com.flagship.revenue_ledger.config.TransactionRunner;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.DateRange;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.observability.LedgerMetrics;
import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Append-only log of the budget optimizer's cross-platform shifts. Rows are never
 * updated; a correction is a new shift in the opposite direction.
 */
@Service
@Slf4j
public class BudgetReallocationService {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 500;

    private final BudgetReallocationRepository repository;
    private final TransactionRunner transactionRunner;
    private final LedgerMetrics metrics;
    private final Validator validator;
    private final Clock clock;

    public BudgetReallocationService(BudgetReallocationRepository repository,
                                     TransactionRunner transactionRunner,
                                     LedgerMetrics metrics,
                                     Validator validator,
                                     Clock clock) {
        this.repository = repository;
        this.transactionRunner = transactionRunner;
        this.metrics = metrics;
        this.validator = validator;
        this.clock = clock;
    }

    /**
     * @throws ValidationException on a blank client, a non-positive amount or a shift onto the same platform
     */
    public BudgetReallocation record(String clientId, BudgetReallocationRequest request, Duration timeout) {
        validate(clientId, request);
        Instant now = clock.instant();

        try (CorrelationContext.Scope ignored = CorrelationContext.forClient(clientId)) {
            BudgetReallocation reallocation = BudgetReallocation.builder()
                    .clientId(clientId)
                    .fromPlatform(request.getFromPlatform().trim())
                    .toPlatform(request.getToPlatform().trim())
                    .amountShifted(UpliftCalculator.currency(request.getAmountShifted()))
                    .fromEfficiency(request.getFromEfficiency())
                    .toEfficiency(request.getToEfficiency())
                    .reason(request.getReason().trim())
                    .shiftedAt(request.getTimestamp() == null ? now : Instant.ofEpochSecond(request.getTimestamp()))
                    .correlationId(CorrelationContext.current())
                    .createdAt(now)
                    .build();

            BudgetReallocation saved = transactionRunner.inTransaction(timeout,
                    () -> repository.saveAndFlush(BudgetReallocationEntity.fromDomain(reallocation)).toDomain());

            metrics.recordBudgetReallocation(saved.getFromPlatform(), saved.getToPlatform());
            log.info("Budget reallocation recorded: id={}, {} -> {}, amount={}, reason={}",
                    saved.getId(), saved.getFromPlatform(), saved.getToPlatform(),
                    saved.getAmountShifted(), saved.getReason());
            return saved;
        }
    }

    /**
     * Newest first within {@code range}.
     */
    public List<BudgetReallocation> list(String clientId, DateRange range, Integer limit, Duration timeout) {
        int pageSize = limit == null ? DEFAULT_LIMIT : limit;
        if (pageSize < 1 || pageSize > MAX_LIMIT) {
            throw new ValidationException("limit", "Limit must be between 1 and " + MAX_LIMIT);
        }
        return transactionRunner.readOnly(timeout, () -> repository
                .findRecent(clientId, range.getFrom(), range.getTo(), PageRequest.of(0, pageSize))
                .stream()
                .map(BudgetReallocationEntity::toDomain)
                .toList());
    }

    private void validate(String clientId, BudgetReallocationRequest request) {
        if (clientId == null || clientId.isBlank()) {
            throw new ValidationException("clientId", "Client ID is required");
        }
        if (request == null) {
            throw new ValidationException("Budget reallocation is required");
        }
        Set<ConstraintViolation<BudgetReallocationRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            Map<String, String> errors = new TreeMap<>();
            for (ConstraintViolation<BudgetReallocationRequest> violation : violations) {
                errors.putIfAbsent(violation.getPropertyPath().toString(), violation.getMessage());
            }
            throw new ValidationException("Budget reallocation validation failed", errors);
        }
        if (request.getFromPlatform().trim().equalsIgnoreCase(request.getToPlatform().trim())) {
            throw new ValidationException("toPlatform", "Budget must move between two different platforms");
        }
    }
}
