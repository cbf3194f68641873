package com.smurthy.ai.chatrouter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Chat completion settings.
 */
@ConfigurationProperties(prefix = "app.generation")
public record GenerationConfig(
        @DefaultValue("30s") Duration timeout,
        @DefaultValue("ollama") String backendName
) {
}
