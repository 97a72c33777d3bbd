package com.croppulse.decision.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCreditScore(String grade, int score) {
        Counter.builder("credit.score.count")
                .tag("grade", grade)
                .register(registry)
                .increment();

        DistributionSummary.builder("credit.score.value")
                .tag("grade", grade)
                .register(registry)
                .record(score);
    }

    public void recordClaimVerdict(String recommendation, double confidence) {
        Counter.builder("claim.verdict.count")
                .tag("recommendation", recommendation)
                .register(registry)
                .increment();

        DistributionSummary.builder("claim.verdict.confidence")
                .tag("recommendation", recommendation)
                .register(registry)
                .record(confidence);
    }

    public void recordEvidenceUnavailable(String source) {
        Counter.builder("evidence.unavailable.count")
                .tag("source", source)
                .register(registry)
                .increment();
    }

    public void recordHarvestAssessment(String urgency) {
        Counter.builder("harvest.assessment.count")
                .tag("urgency", urgency)
                .register(registry)
                .increment();
    }
}
