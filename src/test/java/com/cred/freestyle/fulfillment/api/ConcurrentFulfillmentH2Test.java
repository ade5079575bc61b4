package com.cred.freestyle.fulfillment.api;

import org.junit.jupiter.api.DisplayName;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * Concurrency tests on the embedded H2 database, so every build exercises the row locking.
 */
@SpringBootTest
@DisplayName("Concurrent Fulfillment H2 Tests")
class ConcurrentFulfillmentH2Test extends ConcurrentFulfillmentScenario {
}
