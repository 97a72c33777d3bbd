package com.croppulse.decision.engine.evidence;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.config.MetricsConfig;
import com.croppulse.decision.exception.SourceUnavailableException;
import com.croppulse.decision.model.EvidenceItem;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs independent evidence queries concurrently and joins them against one shared
 * per-request deadline.
 *
 * A query that misses the deadline is cancelled; one that throws is logged. Both are
 * turned into unavailable evidence items so the aggregator can redistribute their
 * weight. If the calling thread is interrupted while waiting, every outstanding query
 * is cancelled and a {@link CancellationException} is thrown.
 */
@Component
public class EvidenceFetcher {

    private static final Logger log = LoggerFactory.getLogger(EvidenceFetcher.class);

    private final ExecutorService executor;
    private final DecisionConfig config;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    public EvidenceFetcher(@Qualifier("evidenceExecutor") ExecutorService executor,
                           DecisionConfig config, Tracer tracer, MetricsConfig metricsConfig) {
        this.executor = executor;
        this.config = config;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @return the produced items of every task in task order; a failed or late task
     *         contributes one unavailable item per declared factor
     */
    public List<EvidenceItem> fetchAll(List<EvidenceTask> tasks) {
        long timeoutMs = config.getEvidence().getTimeoutMs();
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);

        List<Span> spans = new ArrayList<>(tasks.size());
        List<Future<List<EvidenceItem>>> futures = new ArrayList<>(tasks.size());
        for (EvidenceTask task : tasks) {
            Span span = tracer.nextSpan()
                    .name("evidence.fetch." + task.source())
                    .tag("evidence.source", task.source().name())
                    .start();
            spans.add(span);
            try {
                futures.add(executor.submit(() -> {
                    try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                        return task.call().call();
                    }
                }));
            } catch (RejectedExecutionException e) {
                log.error("Evidence executor rejected {} fetch: {}", task.source(), e.getMessage());
                futures.add(null);
            }
        }

        List<EvidenceItem> results = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            EvidenceTask task = tasks.get(i);
            Future<List<EvidenceItem>> future = futures.get(i);
            Span span = spans.get(i);
            List<EvidenceItem> items;
            try {
                if (future == null) {
                    items = unavailable(task, "evidence executor saturated");
                } else {
                    long remaining = Math.max(0L, deadline - System.nanoTime());
                    items = future.get(remaining, TimeUnit.NANOSECONDS);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("{} evidence timed out after {}ms, treating as unavailable", task.source(), timeoutMs);
                items = unavailable(task, "timed out after " + timeoutMs + "ms");
            } catch (ExecutionException e) {
                items = unavailable(task, describeFailure(task, e.getCause()));
                span.error(e.getCause());
            } catch (InterruptedException e) {
                cancelAll(futures);
                spans.subList(i, spans.size()).forEach(Span::end);
                Thread.currentThread().interrupt();
                CancellationException cancelled =
                        new CancellationException("Evidence fetch interrupted, outstanding sources cancelled");
                cancelled.initCause(e);
                throw cancelled;
            } catch (CancellationException e) {
                items = unavailable(task, "fetch cancelled");
            }

            boolean allAvailable = items.stream().allMatch(EvidenceItem::isAvailable);
            span.tag("evidence.available", String.valueOf(allAvailable));
            span.end();

            for (EvidenceItem item : items) {
                if (!item.isAvailable()) {
                    metricsConfig.recordEvidenceUnavailable(task.source().name());
                    log.debug("{} evidence '{}' unavailable: {}", task.source(), item.getFactor(), item.getReason());
                } else {
                    log.debug("{} evidence '{}' = {} ({})", task.source(), item.getFactor(),
                            item.getValue(), item.getReason());
                }
            }
            results.addAll(items);
        }
        return results;
    }

    private String describeFailure(EvidenceTask task, Throwable cause) {
        if (cause instanceof SourceUnavailableException) {
            log.warn("{} evidence unavailable: {}", task.source(), cause.getMessage());
            return cause.getMessage();
        }
        log.error("Unexpected failure fetching {} evidence: {}", task.source(),
                cause == null ? "unknown" : cause.getMessage(), cause);
        return "source failed: " + (cause == null ? "unknown error" : cause.getClass().getSimpleName());
    }

    private static List<EvidenceItem> unavailable(EvidenceTask task, String reason) {
        List<EvidenceItem> items = new ArrayList<>(task.factors().size());
        for (String factor : task.factors()) {
            items.add(EvidenceItem.unavailable(task.source(), factor, reason));
        }
        return items;
    }

    private static void cancelAll(List<Future<List<EvidenceItem>>> futures) {
        for (Future<List<EvidenceItem>> f : futures) {
            if (f != null) {
                f.cancel(true);
            }
        }
    }
}
