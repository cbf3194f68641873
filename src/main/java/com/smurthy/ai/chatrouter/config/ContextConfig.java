package com.smurthy.ai.chatrouter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Prompt context budget, in characters.
 */
@ConfigurationProperties(prefix = "app.context")
public record ContextConfig(
        @DefaultValue("2000") int maxLength
) {
}
