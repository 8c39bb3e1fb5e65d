package com.flagship.revenue_ledger.client;

import com.flagship.revenue_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;

/**
 * Per-client fee percentage and confidence threshold, falling back to the
 * configured defaults for clients without explicit terms.
 */
@Service
@Slf4j
public class ClientTermsService {

    private static final int TERMS_SCALE = 4;

    private final ClientTermsRepository repository;
    private final Clock clock;
    private final BigDecimal defaultFeePercentage;
    private final BigDecimal defaultConfidenceThreshold;

    public ClientTermsService(ClientTermsRepository repository,
                              Clock clock,
                              @Value("${ledger.fee.default-percentage:0.20}") BigDecimal defaultFeePercentage,
                              @Value("${ledger.attribution.confidence-threshold:0.70}") BigDecimal defaultConfidenceThreshold) {
        this.repository = repository;
        this.clock = clock;
        this.defaultFeePercentage = normalizeFee(defaultFeePercentage);
        this.defaultConfidenceThreshold = normalizeThreshold(defaultConfidenceThreshold);
    }

    @Transactional(readOnly = true)
    public ClientTerms getTerms(String clientId) {
        return repository.findById(clientId)
                .map(ClientTermsEntity::toDomain)
                .orElseGet(() -> new ClientTerms(clientId, defaultFeePercentage, defaultConfidenceThreshold,
                        false, null));
    }

    @Transactional
    public ClientTerms putTerms(String clientId, BigDecimal feePercentage, BigDecimal confidenceThreshold) {
        BigDecimal fee = normalizeFee(feePercentage);
        BigDecimal threshold = normalizeThreshold(confidenceThreshold);

        ClientTermsEntity entity = repository.findById(clientId)
                .map(existing -> {
                    existing.update(fee, threshold, clock.instant());
                    return existing;
                })
                .orElseGet(() -> ClientTermsEntity.create(clientId, fee, threshold, clock.instant()));

        ClientTerms saved = repository.saveAndFlush(entity).toDomain();
        log.info("Client terms updated: clientId={}, feePercentage={}, confidenceThreshold={}",
                clientId, fee, threshold);
        return saved;
    }

    private static BigDecimal normalizeFee(BigDecimal fee) {
        if (fee == null || fee.signum() <= 0 || fee.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException("feePercentage", "Fee percentage must be greater than 0 and at most 1");
        }
        return scaled("feePercentage", fee);
    }

    private static BigDecimal normalizeThreshold(BigDecimal threshold) {
        if (threshold == null || threshold.signum() < 0 || threshold.compareTo(BigDecimal.ONE) > 0) {
            throw new ValidationException("confidenceThreshold", "Confidence threshold must be between 0 and 1");
        }
        return scaled("confidenceThreshold", threshold);
    }

    private static BigDecimal scaled(String field, BigDecimal value) {
        if (value.stripTrailingZeros().scale() > TERMS_SCALE) {
            throw new ValidationException(field, "At most " + TERMS_SCALE + " decimal places are supported");
        }
        return value.setScale(TERMS_SCALE, RoundingMode.UNNECESSARY);
    }
}
