package com.lifebutler.assistant.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AssistantConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Pool for the concurrent halves of a hybrid request.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService hybridExecutor(AssistantProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "hybrid-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(2, properties.getProcessor().getPoolSize()), factory);
    }

    /**
     * Single worker for embedding rebuilds, kept apart from the request pool.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService rebuildExecutor() {
        return Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "embedding-rebuild");
            thread.setDaemon(true);
            return thread;
        });
    }
}
