package com.vaultsphere.auth.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

import static com.vaultsphere.auth.domain.constants.AuthConstants.SECURITY_EVENTS_TOPIC;

@Configuration
public class KafkaTopicConfig {

    @Bean
    public NewTopic securityEventsTopic(
            @Value("${vaultsphere.auth.events.partitions:3}") int partitions,
            @Value("${vaultsphere.auth.events.replicas:1}") int replicas) {
        return TopicBuilder.name(SECURITY_EVENTS_TOPIC)
                .partitions(partitions)
                .replicas(replicas)
                .build();
    }
}
