package com.cred.freestyle.fulfillment.infrastructure.messaging;

import com.cred.freestyle.fulfillment.infrastructure.messaging.events.FulfillmentEvent;
import com.cred.freestyle.fulfillment.infrastructure.messaging.events.OrderConfirmationEmailMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for fulfillment events and order confirmation emails.
 *
 * Topic partitioning:
 * - Fulfillment events keyed by order ID
 * - Email messages keyed by order number
 *
 * Serialization failures are raised as {@link IllegalStateException} so the
 * post-commit dispatcher counts them as a failed step.
 *
 * @author Fulfillment Team
 */
@Service
public class KafkaProducerService {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String fulfillmentTopic;
    private final String emailTopic;

    public KafkaProducerService(KafkaTemplate<String, String> kafkaTemplate,
                                ObjectMapper objectMapper,
                                @Value("${storefront.kafka.topics.fulfillment-events:storefront-fulfillment-events}") String fulfillmentTopic,
                                @Value("${storefront.kafka.topics.email-notifications:storefront-email-notifications}") String emailTopic) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.fulfillmentTopic = fulfillmentTopic;
        this.emailTopic = emailTopic;
    }

    /**
     * Publish a fulfillment event.
     *
     * @param event Fulfillment event
     */
    public void publishFulfillmentEvent(FulfillmentEvent event) {
        String payload = serialize(event, "fulfillment event for order " + event.getOrderId());
        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                fulfillmentTopic,
                event.getOrderId(),
                payload
        );

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                logger.info("Published {} fulfillment event for order {}, partition: {}",
                        event.getOutcome(), event.getOrderId(), result.getRecordMetadata().partition());
            } else {
                logger.error("Failed to publish {} fulfillment event for order {}",
                        event.getOutcome(), event.getOrderId(), ex);
            }
        });
    }

    /**
     * Publish an order confirmation email request.
     *
     * @param message Email message
     */
    public void publishOrderConfirmation(OrderConfirmationEmailMessage message) {
        String payload = serialize(message, "confirmation email for order " + message.getOrderNumber());
        CompletableFuture<SendResult<String, String>> future = kafkaTemplate.send(
                emailTopic,
                message.getOrderNumber(),
                payload
        );

        future.whenComplete((result, ex) -> {
            if (ex == null) {
                logger.info("Queued confirmation email for order {}", message.getOrderNumber());
            } else {
                logger.error("Failed to queue confirmation email for order {}", message.getOrderNumber(), ex);
            }
        });
    }

    private String serialize(Object value, String description) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {}", description, e);
            throw new IllegalStateException("Could not serialize " + description, e);
        }
    }
}
