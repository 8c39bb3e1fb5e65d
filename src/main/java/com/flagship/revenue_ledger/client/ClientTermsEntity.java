package com.flagship.revenue_ledger.client;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "client_terms")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClientTermsEntity {

    @Id
    @Column(name = "client_id", nullable = false, updatable = false, length = 64)
    private String clientId;

    @Column(name = "fee_percentage", nullable = false, precision = 5, scale = 4)
    private BigDecimal feePercentage;

    @Column(name = "confidence_threshold", nullable = false, precision = 5, scale = 4)
    private BigDecimal confidenceThreshold;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static ClientTermsEntity create(String clientId, BigDecimal feePercentage,
                                    BigDecimal confidenceThreshold, Instant now) {
        return new ClientTermsEntity(clientId, feePercentage, confidenceThreshold, now);
    }

    void update(BigDecimal feePercentage, BigDecimal confidenceThreshold, Instant now) {
        this.feePercentage = feePercentage;
        this.confidenceThreshold = confidenceThreshold;
        this.updatedAt = now;
    }

    ClientTerms toDomain() {
        return new ClientTerms(clientId, feePercentage, confidenceThreshold, true, updatedAt);
    }
}
