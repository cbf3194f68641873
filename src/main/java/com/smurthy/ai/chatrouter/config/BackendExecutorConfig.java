package com.smurthy.ai.chatrouter.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class BackendExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(BackendExecutorConfig.class);

    /**
     * Pool that runs retrieval and generation calls so the caller can wait on them with a deadline.
     * Spring shuts it down with the context.
     */
    @Bean
    public ExecutorService backendCallExecutorService(RoutingConfig routingConfig) {
        int threads = Math.max(2, routingConfig.executorThreads());
        log.info("Creating backend call pool with {} threads", threads);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "backend-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, threadFactory);
    }
}
