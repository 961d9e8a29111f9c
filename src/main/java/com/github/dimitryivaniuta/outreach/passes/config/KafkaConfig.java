package com.github.dimitryivaniuta.outreach.passes.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic configuration.
 */
@Configuration
public class KafkaConfig {

    /**
     * Topic read by the email sender. Records are keyed by attendee id, so the notifications of one attendee stay
     * ordered on one partition; the value is a {@code PassIssuedNotification} JSON document.
     *
     * <p>Only takes effect where the Kafka admin may create topics (local and test runs).</p>
     *
     * @param props application properties
     * @return topic definition
     */
    @Bean
    public NewTopic passNotificationsTopic(AppProperties props) {
        AppProperties.Notification notification = props.getNotification();
        return TopicBuilder.name(notification.getTopic())
                .partitions(notification.getTopicPartitions())
                .replicas(notification.getTopicReplicas())
                .build();
    }
}
