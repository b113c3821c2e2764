package com.keer.seating.config;

import com.keer.seating.store.StoreRetryPolicy;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@Slf4j
public class SeatingConfig {

    public static final String DELIVERY_EXECUTOR = "deltaDeliveryExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Retry storeRetry(SeatingProperties properties) {
        Retry retry = StoreRetryPolicy.create(properties.getStore());
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying store call, attempt {}: {}", event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));
        return retry;
    }

    @Bean(name = DELIVERY_EXECUTOR)
    public ThreadPoolTaskExecutor deltaDeliveryExecutor(SeatingProperties properties) {
        int threads = properties.getBroadcast().getDeliveryThreads();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("delta-delivery-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
