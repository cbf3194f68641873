package com.smurthy.ai.chatrouter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Vector store retrieval settings.
 */
@ConfigurationProperties(prefix = "app.retrieval")
public record RetrievalConfig(
        @DefaultValue("3") int topK,
        @DefaultValue("0.0") double similarityThreshold,
        @DefaultValue("10s") Duration timeout,
        @DefaultValue("chroma") String backendName,
        String filterExpression
) {
}
