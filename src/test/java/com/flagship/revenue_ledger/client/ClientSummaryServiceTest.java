package com.flagship.revenue_ledger.client;

import com.flagship.revenue_ledger.attribution.Agent;
import com.flagship.revenue_ledger.client.dto.ClientSummaryResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ClientSummaryServiceTest {

    @Test
    @DisplayName("Attribution rate is a percentage of all recorded orders")
    void attributionRate() {
        assertEquals(new BigDecimal("50.00"), ClientSummaryService.attributionRate(3, 6));
        assertEquals(new BigDecimal("33.33"), ClientSummaryService.attributionRate(1, 3));
        assertEquals(new BigDecimal("0.00"), ClientSummaryService.attributionRate(0, 0));
    }

    @Test
    @DisplayName("Orders not credited to an agent count towards the platform")
    void platformGetsRemainder() {
        Map<Agent, BigDecimal> totals = new EnumMap<>(Agent.class);
        totals.put(Agent.BID_OPTIMIZER, new BigDecimal("1.5000"));
        totals.put(Agent.LTV_TARGETING, BigDecimal.ZERO);
        totals.put(Agent.CREATIVE_STUDIO, new BigDecimal("0.5000"));
        totals.put(Agent.NURTURE_FLOWS, BigDecimal.ZERO);

        List<ClientSummaryResponse.AgentShare> shares = ClientSummaryService.topAgents(totals, 4);

        assertEquals(3, shares.size());
        assertEquals("Platform", shares.get(0).getAgent());
        assertEquals(new BigDecimal("0.5000"), shares.get(0).getShare());
        assertEquals("Bid Optimizer", shares.get(1).getAgent());
        assertEquals(new BigDecimal("0.3750"), shares.get(1).getShare());
        assertEquals("Creative Studio", shares.get(2).getAgent());
        assertEquals(new BigDecimal("0.1250"), shares.get(2).getShare());
    }

    @Test
    @DisplayName("No attributed orders means no agents")
    void noAttributedOrders() {
        assertTrue(ClientSummaryService.topAgents(new EnumMap<>(Agent.class), 0).isEmpty());
    }
}
