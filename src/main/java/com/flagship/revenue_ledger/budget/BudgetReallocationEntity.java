package com.flagship.revenue_ledger.budget;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "budget_reallocation_log")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BudgetReallocationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "client_id", nullable = false, updatable = false, length = 64)
    private String clientId;

    @Column(name = "from_platform", nullable = false, updatable = false, length = 50)
    private String fromPlatform;

    @Column(name = "to_platform", nullable = false, updatable = false, length = 50)
    private String toPlatform;

    @Column(name = "amount_shifted", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal amountShifted;

    @Column(name = "from_efficiency", updatable = false, precision = 7, scale = 2)
    private BigDecimal fromEfficiency;

    @Column(name = "to_efficiency", updatable = false, precision = 7, scale = 2)
    private BigDecimal toEfficiency;

    @Column(name = "reason", nullable = false, updatable = false, length = 2000)
    private String reason;

    @Column(name = "shifted_at", nullable = false, updatable = false)
    private Instant shiftedAt;

    @Column(name = "correlation_id", updatable = false, length = 64)
    private String correlationId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static BudgetReallocationEntity fromDomain(BudgetReallocation reallocation) {
        return new BudgetReallocationEntity(
            null,
            reallocation.getClientId(),
            reallocation.getFromPlatform(),
            reallocation.getToPlatform(),
            reallocation.getAmountShifted(),
            reallocation.getFromEfficiency(),
            reallocation.getToEfficiency(),
            reallocation.getReason(),
            reallocation.getShiftedAt(),
            reallocation.getCorrelationId(),
            reallocation.getCreatedAt()
        );
    }

    public BudgetReallocation toDomain() {
        return BudgetReallocation.builder()
            .id(id)
            .clientId(clientId)
            .fromPlatform(fromPlatform)
            .toPlatform(toPlatform)
            .amountShifted(amountShifted)
            .fromEfficiency(fromEfficiency)
            .toEfficiency(toEfficiency)
            .reason(reason)
            .shiftedAt(shiftedAt)
            .correlationId(correlationId)
            .createdAt(createdAt)
            .build();
    }
}
