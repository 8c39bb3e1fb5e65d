package com.flagship.revenue_ledger.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.revenue_ledger.exception.GlobalExceptionHandler;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;

/**
 * Rejects every {@code /api/**} request that does not carry the pre-shared
 * {@code x-internal-api-key}. An unset key rejects everything.
 *
 * Runs right after {@link com.flagship.revenue_ledger.observability.CorrelationIdFilter}
 * so rejections are still logged with a correlation id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
public class InternalApiKeyFilter extends OncePerRequestFilter {

    public static final String HEADER = "x-internal-api-key";

    private final byte[] expectedKey;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public InternalApiKeyFilter(@Value("${ledger.security.internal-api-key:}") String internalApiKey,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.expectedKey = internalApiKey == null ? new byte[0] : internalApiKey.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
        this.clock = clock;
        if (expectedKey.length == 0) {
            log.warn("ledger.security.internal-api-key is not set; all /api requests will be rejected");
        }
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String presented = request.getHeader(HEADER);
        if (!matches(presented)) {
            log.warn("Rejected unauthenticated request: {} {}", request.getMethod(), request.getRequestURI());
            reject(response, presented == null ? "Missing " + HEADER + " header" : "Invalid internal API key");
            return;
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    private boolean matches(String presented) {
        if (expectedKey.length == 0 || presented == null) {
            return false;
        }
        return MessageDigest.isEqual(expectedKey, presented.getBytes(StandardCharsets.UTF_8));
    }

    private void reject(HttpServletResponse response, String message) throws IOException {
        GlobalExceptionHandler.ErrorResponse error = GlobalExceptionHandler.ErrorResponse.builder()
            .error("UNAUTHORIZED")
            .message(message)
            .timestamp(clock.instant())
            .build();
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), error);
    }
}
