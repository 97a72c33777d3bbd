package com.croppulse.decision.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class EvidenceExecutorConfig {

    /** Pool used to fetch independent evidence sources concurrently. */
    @Bean(name = "evidenceExecutor", destroyMethod = "shutdownNow")
    public ExecutorService evidenceExecutor(DecisionConfig config) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(config.getEvidence().getPoolSize(), r -> {
            Thread t = new Thread(r, "evidence-fetch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
