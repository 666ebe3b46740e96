package com.flagship.finance_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics the ledger publishes to and consumes from. All are keyed by organization id, so
 * events of one tenant stay ordered within a partition.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.period-locks:period-locks}")
    private String periodLocksTopic;

    @Value("${kafka.topic.journal-entries:journal-entries}")
    private String journalEntriesTopic;

    @Value("${kafka.topic.finance-documents:finance-documents}")
    private String financeDocumentsTopic;

    @Bean
    public NewTopic periodLocksTopic() {
        return TopicBuilder.name(periodLocksTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic journalEntriesTopic() {
        return TopicBuilder.name(journalEntriesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic financeDocumentsTopic() {
        return TopicBuilder.name(financeDocumentsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
