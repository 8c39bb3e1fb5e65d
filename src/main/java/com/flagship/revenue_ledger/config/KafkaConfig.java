package com.flagship.revenue_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Outbound topics. Both are keyed by client id, so the partition count bounds how
 * many clients' events a consumer group can process in parallel. Settlement events
 * are rare and small, hence fewer partitions.
 *
 * The inbound order topic belongs to the order-ingest collaborator and is not
 * declared here.
 */
@Configuration
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
public class KafkaConfig {

    @Value("${kafka.topic.ledger-entries:ledger-entries}")
    private String ledgerEntriesTopic;

    @Value("${kafka.topic.settlements:ledger-settlements}")
    private String settlementsTopic;

    @Value("${kafka.topic.ledger-entries-partitions:6}")
    private int ledgerEntriesPartitions;

    @Value("${kafka.topic.replicas:1}")
    private int replicas;

    @Bean
    public NewTopic ledgerEntriesTopic() {
        return TopicBuilder.name(ledgerEntriesTopic)
                .partitions(ledgerEntriesPartitions)
                .replicas(replicas)
                .build();
    }

    @Bean
    public NewTopic settlementsTopic() {
        return TopicBuilder.name(settlementsTopic)
                .partitions(Math.max(1, ledgerEntriesPartitions / 2))
                .replicas(replicas)
                .build();
    }
}
