package com.smurthy.ai.chatrouter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Routing behaviour toggles.
 *
 * @param cannedGreetings answer greetings from a fixed reply table instead of calling the chat model
 * @param executorThreads size of the pool that runs backend calls under a deadline
 */
@ConfigurationProperties(prefix = "app.routing")
public record RoutingConfig(
        @DefaultValue("false") boolean cannedGreetings,
        @DefaultValue("8") int executorThreads
) {
}
