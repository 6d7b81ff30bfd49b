package com.devflow.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure beans for the pipeline.
 */
@Configuration
public class CoreConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Runs per-project monitoring lanes, decision-loop passes and bounded provider calls.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService devflowExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "devflow-pipeline-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
