package com.cred.freestyle.fulfillment.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async configuration for post-commit dispatch.
 * Side effects of a committed webhook run on a dedicated pool so the provider gets its
 * acknowledgement without waiting for email, provisioning or the conflict sweep.
 *
 * @author Fulfillment Team
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    public static final String DISPATCH_EXECUTOR = "fulfillmentDispatchExecutor";

    @Value("${storefront.fulfillment.dispatch.core-pool-size:4}")
    private Integer corePoolSize;

    @Value("${storefront.fulfillment.dispatch.max-pool-size:16}")
    private Integer maxPoolSize;

    @Value("${storefront.fulfillment.dispatch.queue-capacity:500}")
    private Integer queueCapacity;

    @Value("${storefront.fulfillment.dispatch.await-termination-seconds:30}")
    private Integer awaitTerminationSeconds;

    /**
     * Executor for {@code PostCommitDispatcher}.
     * Saturation falls back to the caller thread rather than dropping side effects.
     *
     * @return ThreadPoolTaskExecutor
     */
    @Bean(name = DISPATCH_EXECUTOR)
    public ThreadPoolTaskExecutor fulfillmentDispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("fulfillment-dispatch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitTerminationSeconds);
        executor.initialize();

        logger.info("Initialized fulfillment dispatch executor - Core: {}, Max: {}, Queue: {}",
                corePoolSize, maxPoolSize, queueCapacity);
        return executor;
    }
}
