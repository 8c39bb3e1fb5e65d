package com.flagship.revenue_ledger.client;

import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.support.LedgerFixtures;
import com.flagship.revenue_ledger.support.TestClockConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(TestClockConfig.class)
class ClientTermsServiceTest {

    @Autowired
    private ClientTermsService clientTermsService;

    @Test
    @DisplayName("Clients without terms get the configured defaults")
    void defaults() {
        ClientTerms terms = clientTermsService.getTerms(LedgerFixtures.newClientId());

        assertFalse(terms.isCustom());
        assertEquals(new BigDecimal("0.2000"), terms.getFeePercentage());
        assertEquals(new BigDecimal("0.7000"), terms.getConfidenceThreshold());
    }

    @Test
    @DisplayName("Stored terms replace the defaults and can be changed")
    void putTerms() {
        String clientId = LedgerFixtures.newClientId();

        clientTermsService.putTerms(clientId, new BigDecimal("0.15"), new BigDecimal("0.8"));
        clientTermsService.putTerms(clientId, new BigDecimal("0.125"), new BigDecimal("0.75"));
        ClientTerms terms = clientTermsService.getTerms(clientId);

        assertTrue(terms.isCustom());
        assertEquals(0, new BigDecimal("0.125").compareTo(terms.getFeePercentage()));
        assertEquals(0, new BigDecimal("0.75").compareTo(terms.getConfidenceThreshold()));
        assertNotNull(terms.getUpdatedAt());
    }

    @Test
    @DisplayName("Fee must be in (0, 1] and threshold in [0, 1]")
    void ranges() {
        String clientId = LedgerFixtures.newClientId();

        assertThrows(ValidationException.class,
                () -> clientTermsService.putTerms(clientId, BigDecimal.ZERO, new BigDecimal("0.7")));
        assertThrows(ValidationException.class,
                () -> clientTermsService.putTerms(clientId, new BigDecimal("1.01"), new BigDecimal("0.7")));
        assertThrows(ValidationException.class,
                () -> clientTermsService.putTerms(clientId, new BigDecimal("0.2"), new BigDecimal("-0.1")));
        assertThrows(ValidationException.class,
                () -> clientTermsService.putTerms(clientId, new BigDecimal("0.12345"), new BigDecimal("0.7")));
        assertDoesNotThrow(() -> clientTermsService.putTerms(clientId, BigDecimal.ONE, BigDecimal.ZERO));
    }
}
