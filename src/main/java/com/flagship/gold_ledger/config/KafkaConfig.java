package com.flagship.gold_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Audit-log topics, one per aggregate type. Events are keyed by aggregate id, so all events
 * of one asset, account, order or member land on the same partition in order.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.assets:gold.assets}")
    private String assetsTopic;

    @Value("${kafka.topic.ledger:gold.ledger}")
    private String ledgerTopic;

    @Value("${kafka.topic.orders:gold.orders}")
    private String ordersTopic;

    @Value("${kafka.topic.members:gold.members}")
    private String membersTopic;

    @Bean
    public NewTopic assetsTopic() {
        return topic(assetsTopic);
    }

    @Bean
    public NewTopic ledgerTopic() {
        return topic(ledgerTopic);
    }

    @Bean
    public NewTopic ordersTopic() {
        return topic(ordersTopic);
    }

    @Bean
    public NewTopic membersTopic() {
        return TopicBuilder.name(membersTopic)
                .partitions(1)
                .replicas(1)
                .build();
    }

    private NewTopic topic(String name) {
        return TopicBuilder.name(name)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
