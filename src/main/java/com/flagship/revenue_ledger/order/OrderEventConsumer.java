package com.flagship.revenue_ledger.order;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.revenue_ledger.exception.NotFoundException;
import com.flagship.revenue_ledger.exception.ValidationException;
import com.flagship.revenue_ledger.observability.CorrelationContext;
import com.flagship.revenue_ledger.order.dto.AttributionResult;
import com.flagship.revenue_ledger.order.dto.RecordOrderRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Kafka listener for order events published by the order-ingest collaborator.
 *
 * Payloads use the same JSON as {@code POST /api/v1/ledger/orders}. Offsets are
 * committed manually:
 * - recorded or duplicate: acknowledged
 * - unparseable, invalid, or no baseline for the client: logged and acknowledged,
 *   redelivery cannot fix them
 * - anything else (storage down, timeouts): not acknowledged, the broker redelivers
 *   and the replay is answered idempotently from the ledger
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class OrderEventConsumer {

    private final OrderAttributionService orderAttributionService;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.orders-inbound:order-events}",
        groupId = "${spring.kafka.consumer.group-id:revenue-ledger-order-ingest}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        CorrelationContext.begin(headerValue(record, CorrelationContext.CORRELATION_ID_HEADER));
        log.debug("Received order event: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        try {
            RecordOrderRequest request = parse(record.value());
            if (request == null) {
                log.warn("Could not parse order event at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            AttributionResult result = orderAttributionService.recordOrder(request, null);
            ack.acknowledge();
            log.info("Processed order event: externalOrderId={}, entryHash={}, duplicate={}",
                    request.getExternalOrderId(), result.getEntryHash(), result.isDuplicate());

        } catch (ValidationException | NotFoundException e) {
            log.warn("Rejected order event at offset {}: {} ({}), acknowledging to skip",
                    record.offset(), e.getMessage(), e.getErrorCode());
            ack.acknowledge();
        } catch (Exception e) {
            log.error("Error processing order event at offset {}: {}", record.offset(), e.getMessage(), e);
            // Not acknowledged; the message will be redelivered.
            throw e;
        } finally {
            CorrelationContext.end();
        }
    }

    private static String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header != null && header.value() != null
                ? new String(header.value(), StandardCharsets.UTF_8)
                : null;
    }

    private RecordOrderRequest parse(String json) {
        try {
            return objectMapper.readValue(json, RecordOrderRequest.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse order event: {}", e.getMessage());
            return null;
        }
    }
}
