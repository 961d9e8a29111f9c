package com.github.dimitryivaniuta.outreach.passes.service.issuance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.outreach.passes.config.AppProperties;
import com.github.dimitryivaniuta.outreach.passes.service.events.PassIssuedNotification;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes pass notifications to Kafka and waits for the broker ack (bounded by {@code sendTimeout}).
 */
@Component
public class KafkaPassNotifier implements PassNotifier {

    private static final Logger log = LoggerFactory.getLogger(KafkaPassNotifier.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties properties;

    public KafkaPassNotifier(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper, AppProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void sendPassNotification(PassIssuedNotification notification) {
        AppProperties.Notification cfg = properties.getNotification();
        String payload = toJson(notification);
        try {
            kafkaTemplate.send(cfg.getTopic(), notification.attendeeId(), payload)
                    .get(cfg.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Pass notification {} published to {}", notification.notificationId(), cfg.getTopic());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while publishing pass notification", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new NotificationException("Pass notification rejected: " + cause.getMessage(), cause);
        } catch (TimeoutException ex) {
            throw new NotificationException("Pass notification not acknowledged within " + cfg.getSendTimeout(), ex);
        }
    }

    private String toJson(PassIssuedNotification notification) {
        try {
            return objectMapper.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new NotificationException("Unable to serialize pass notification", e);
        }
    }
}
