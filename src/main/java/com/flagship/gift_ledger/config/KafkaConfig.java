package com.flagship.gift_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.gifts:gift-events}")
    private String giftsTopic;

    /**
     * Gift lifecycle events, partitioned by purchase or gift transaction id.
     */
    @Bean
    public NewTopic giftsTopic() {
        return TopicBuilder.name(giftsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
