package com.smurthy.ai.chatrouter.config;

import org.springframework.ai.retry.TransientAiException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;

import java.util.Map;

/**
 * Retry policy for the retrieval and chat backends.
 *
 * Spring AI's model auto-configuration only creates its own RetryTemplate when none exists,
 * so the chat model picks this one up as well.
 */
@Configuration
public class RetryConfig {

    @Bean
    public RetryTemplate retryTemplate(
            @Value("${app.retry.max-attempts:2}") int maxAttempts,
            @Value("${app.retry.initial-interval-ms:500}") long initialIntervalMs,
            @Value("${app.retry.multiplier:2.0}") double multiplier,
            @Value("${app.retry.max-interval-ms:2000}") long maxIntervalMs) {
        RetryTemplate retryTemplate = new RetryTemplate();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(initialIntervalMs);
        backOffPolicy.setMultiplier(multiplier);
        backOffPolicy.setMaxInterval(maxIntervalMs);
        retryTemplate.setBackOffPolicy(backOffPolicy);

        // Only transient failures are worth another attempt; traverse causes so wrapped I/O errors count
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(maxAttempts, Map.of(
                TransientAiException.class, true,
                ResourceAccessException.class, true), true);
        retryTemplate.setRetryPolicy(retryPolicy);

        return retryTemplate;
    }
}
