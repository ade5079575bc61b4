package com.cred.freestyle.fulfillment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the subscription storefront fulfillment engine.
 *
 * System Overview:
 * - Receives asynchronous payment webhooks from external providers (Cryptomus, Weepay)
 * - Verifies provider signatures before touching any record
 * - Maps provider status vocabularies onto a small canonical set
 * - Re-validates one-time-use stock inside a single database transaction
 * - Creates user subscriptions and hands items over to delivery provisioning
 * - Cancels competing pending orders whose stock has been exhausted
 *
 * Architecture:
 * - API Layer: webhook receiver and admin reconciliation endpoint
 * - Service Layer: verify, map, resolve, commit, then dispatch side effects
 * - Data Access Layer: JPA repositories with pessimistic locking
 * - Infrastructure Layer: Redis replay cache, Kafka events, CloudWatch metrics
 *
 * Key Guarantees:
 * - A customer is never charged without receiving the product or being flagged for refund
 * - A stock item is allocated to at most one order item, ever
 * - Re-delivered webhooks never create duplicate subscriptions
 *
 * @author Fulfillment Team
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableJpaRepositories
@EnableTransactionManagement
public class FulfillmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(FulfillmentApplication.class, args);
    }
}
