package com.flagship.revenue_ledger.client;

import com.flagship.revenue_ledger.attribution.Agent;
import com.flagship.revenue_ledger.baseline.BaselineService;
import com.flagship.revenue_ledger.baseline.BaselineSnapshot;
import com.flagship.revenue_ledger.client.dto.ClientSummaryResponse;
import com.flagship.revenue_ledger.config.TransactionRunner;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.ledger.LedgerEntry;
import com.flagship.revenue_ledger.ledger.LedgerStore;
import com.flagship.revenue_ledger.uplift.UpliftCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Read models for the client dashboard: the summary and the live attribution feed.
 */
@Service
@Slf4j
public class ClientSummaryService {

    private static final int SHARE_SCALE = 4;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BaselineService baselineService;
    private final LedgerStore ledgerStore;
    private final TransactionRunner transactionRunner;
    private final int defaultLiveLimit;
    private final int maxLiveLimit;

    public ClientSummaryService(BaselineService baselineService,
                                LedgerStore ledgerStore,
                                TransactionRunner transactionRunner,
                                @Value("${ledger.live.default-limit:10}") int defaultLiveLimit,
                                @Value("${ledger.live.max-limit:100}") int maxLiveLimit) {
        this.baselineService = baselineService;
        this.ledgerStore = ledgerStore;
        this.transactionRunner = transactionRunner;
        this.defaultLiveLimit = defaultLiveLimit;
        this.maxLiveLimit = maxLiveLimit;
    }

    /**
     * @throws com.flagship.revenue_ledger.exception.BaselineNotFoundException if the client has no baseline
     */
    public ClientSummaryResponse getSummary(String clientId, Duration timeout) {
        return transactionRunner.readOnly(timeout, () -> {
            BaselineSnapshot baseline = baselineService.getBaseline(clientId);
            long totalOrders = ledgerStore.countEntries(clientId);
            long attributedOrders = ledgerStore.countAttributed(clientId);

            return ClientSummaryResponse.builder()
                    .clientId(clientId)
                    .platform(baseline.getPlatform())
                    .baseline(ClientSummaryResponse.Baseline.builder()
                            .revenue(baseline.getBaselineRevenue())
                            .orderCount(baseline.getBaselineOrderCount())
                            .avgOrderValue(baseline.getBaselineAvgOrderValue())
                            .adSpend(baseline.getBaselineAdSpend())
                            .profit(baseline.getBaselineProfit())
                            .dataQuality(baseline.getDataQuality())
                            .build())
                    .current(ClientSummaryResponse.Current.builder()
                            .revenue(baseline.getCurrentRevenue())
                            .orderCount(baseline.getCurrentOrderCount())
                            .adSpend(baseline.getCurrentAdSpend())
                            .profit(UpliftCalculator.currency(baseline.currentProfit()))
                            .upliftPercentage(UpliftCalculator.upliftPercentage(
                                    baseline.getCurrentRevenue().subtract(baseline.getBaselineRevenue()),
                                    baseline.getBaselineRevenue()))
                            .periodStartedAt(baseline.getPeriodStartedAt())
                            .build())
                    .incremental(ClientSummaryResponse.Incremental.builder()
                            .revenue(baseline.getTotalIncrementalRevenue())
                            .adSpend(baseline.getTotalIncrementalAdSpend())
                            .netProfitUplift(baseline.getTotalNetProfitUplift())
                            .fees(baseline.getTotalFees())
                            .build())
                    .totalOrders(totalOrders)
                    .attributedOrders(attributedOrders)
                    .attributionRate(attributionRate(attributedOrders, totalOrders))
                    .roi(UpliftCalculator.roi(baseline.getTotalNetProfitUplift(), baseline.getTotalFees()))
                    .topAgents(topAgents(ledgerStore.agentShareTotals(clientId), attributedOrders))
                    .lastSyncedAt(baseline.getLastSyncedAt())
                    .build();
        });
    }

    /**
     * Most recent attributed entries, newest first.
     *
     * @param limit null for the configured default; at most {@code ledger.live.max-limit}
     */
    public List<LedgerEntry> getLiveAttributions(String clientId, Integer limit, Duration timeout) {
        int effective = limit == null ? defaultLiveLimit : limit;
        if (effective < 1 || effective > maxLiveLimit) {
            throw new ValidationException("limit", "Limit must be between 1 and " + maxLiveLimit);
        }
        return transactionRunner.readOnly(timeout, () -> ledgerStore.findRecentAttributed(clientId, effective));
    }

    static BigDecimal attributionRate(long attributed, long total) {
        if (total == 0) {
            return BigDecimal.ZERO.setScale(UpliftCalculator.PERCENT_SCALE);
        }
        return BigDecimal.valueOf(attributed)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), UpliftCalculator.PERCENT_SCALE, RoundingMode.HALF_EVEN);
    }

    /**
     * Per-agent share of the attributed orders, largest first. Orders credited to no
     * individual agent count towards {@link Agent#PLATFORM}.
     */
    static List<ClientSummaryResponse.AgentShare> topAgents(Map<Agent, BigDecimal> totals, long attributedOrders) {
        List<ClientSummaryResponse.AgentShare> shares = new ArrayList<>();
        if (attributedOrders == 0) {
            return shares;
        }
        BigDecimal orders = BigDecimal.valueOf(attributedOrders);
        BigDecimal credited = BigDecimal.ZERO;
        for (Map.Entry<Agent, BigDecimal> total : totals.entrySet()) {
            credited = credited.add(total.getValue());
            addShare(shares, total.getKey(), total.getValue(), orders);
        }
        BigDecimal platform = orders.subtract(credited).max(BigDecimal.ZERO);
        addShare(shares, Agent.PLATFORM, platform, orders);

        shares.sort(Comparator.comparing(ClientSummaryResponse.AgentShare::getShare).reversed());
        return shares;
    }

    private static void addShare(List<ClientSummaryResponse.AgentShare> shares, Agent agent,
                                 BigDecimal total, BigDecimal orders) {
        if (total.signum() > 0) {
            shares.add(new ClientSummaryResponse.AgentShare(agent.getLabel(),
                    total.divide(orders, SHARE_SCALE, RoundingMode.HALF_EVEN)));
        }
    }
}
