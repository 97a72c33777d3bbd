package com.croppulse.decision.engine.evidence;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.config.MetricsConfig;
import com.croppulse.decision.exception.SourceUnavailableException;
import com.croppulse.decision.model.EvidenceItem;
import com.croppulse.decision.model.FactorNames;
import com.croppulse.decision.model.SourceKind;
import com.croppulse.decision.testutil.TestDataFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.croppulse.decision.testutil.TestDataFactory.availableItem;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EvidenceFetcherTest {

    private ExecutorService executor;
    private DecisionConfig config;
    private MeterRegistry registry;
    private EvidenceFetcher fetcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        config = TestDataFactory.validatedConfig();
        config.getEvidence().setTimeoutMs(300);
        registry = new SimpleMeterRegistry();
        fetcher = new EvidenceFetcher(executor, config, Tracer.NOOP, new MetricsConfig(registry));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private double unavailableCount(SourceKind source) {
        Counter counter = registry.find("evidence.unavailable.count").tag("source", source.name()).counter();
        return counter == null ? 0.0 : counter.count();
    }

    @Test
    void fetchAll_returnsItemsInTaskOrder() {
        List<EvidenceItem> items = fetcher.fetchAll(List.of(
                EvidenceTask.single(SourceKind.ACTION, FactorNames.ACTION, () -> {
                    Thread.sleep(50);
                    return availableItem(SourceKind.ACTION, FactorNames.ACTION, 10.0);
                }),
                EvidenceTask.single(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH,
                        () -> availableItem(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH, 20.0))));

        assertThat(items).extracting(EvidenceItem::getFactor)
                .containsExactly(FactorNames.ACTION, FactorNames.GROUND_TRUTH);
        assertThat(items).allMatch(EvidenceItem::isAvailable);
    }

    @Test
    void fetchAll_runsSourcesConcurrently() {
        CountDownLatch bothStarted = new CountDownLatch(2);

        List<EvidenceItem> items = fetcher.fetchAll(List.of(
                EvidenceTask.single(SourceKind.ACTION, FactorNames.ACTION, () -> {
                    bothStarted.countDown();
                    bothStarted.await(250, TimeUnit.MILLISECONDS);
                    return availableItem(SourceKind.ACTION, FactorNames.ACTION, 10.0);
                }),
                EvidenceTask.single(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH, () -> {
                    bothStarted.countDown();
                    bothStarted.await(250, TimeUnit.MILLISECONDS);
                    return availableItem(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH, 20.0);
                })));

        assertThat(bothStarted.getCount()).isZero();
        assertThat(items).allMatch(EvidenceItem::isAvailable);
    }

    @Test
    void fetchAll_slowSource_timesOutAsUnavailable() {
        AtomicBoolean interrupted = new AtomicBoolean();
        long start = System.nanoTime();

        List<EvidenceItem> items = fetcher.fetchAll(List.of(
                EvidenceTask.single(SourceKind.SATELLITE, FactorNames.SATELLITE, () -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        interrupted.set(true);
                        throw e;
                    }
                    return availableItem(SourceKind.SATELLITE, FactorNames.SATELLITE, 100.0);
                }),
                EvidenceTask.single(SourceKind.NEIGHBOR, FactorNames.NEIGHBORS,
                        () -> availableItem(SourceKind.NEIGHBOR, FactorNames.NEIGHBORS, 100.0))));

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(elapsedMs).isLessThan(2_000);
        assertThat(items.get(0).isAvailable()).isFalse();
        assertThat(items.get(0).getReason()).isEqualTo("timed out after 300ms");
        assertThat(items.get(1).isAvailable()).isTrue();
        assertThat(unavailableCount(SourceKind.SATELLITE)).isEqualTo(1.0);
    }

    @Test
    void fetchAll_sourceUnavailable_keepsItsMessage() {
        List<EvidenceItem> items = fetcher.fetchAll(List.of(
                EvidenceTask.single(SourceKind.NEIGHBOR, FactorNames.NEIGHBORS, () -> {
                    throw new SourceUnavailableException(SourceKind.NEIGHBOR, "Report store unreachable");
                })));

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.isAvailable()).isFalse();
            assertThat(item.getReason()).isEqualTo("Report store unreachable");
            assertThat(item.getSourceKind()).isEqualTo(SourceKind.NEIGHBOR);
        });
    }

    @Test
    void fetchAll_unexpectedFailure_reportedAsSourceFailed() {
        List<EvidenceItem> items = fetcher.fetchAll(List.of(
                EvidenceTask.single(SourceKind.ACTION, FactorNames.ACTION, () -> {
                    throw new IllegalStateException("boom");
                }),
                EvidenceTask.single(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH,
                        () -> availableItem(SourceKind.GROUND_TRUTH, FactorNames.GROUND_TRUTH, 20.0))));

        assertThat(items.get(0).isAvailable()).isFalse();
        assertThat(items.get(0).getReason()).isEqualTo("source failed: IllegalStateException");
        assertThat(items.get(1).isAvailable()).isTrue();
    }

    @Test
    void fetchAll_multiFactorTaskFailure_marksEveryDeclaredFactor() {
        List<String> factors = config.traditionalWeights().factorNames();

        List<EvidenceItem> items = fetcher.fetchAll(List.of(
                new EvidenceTask(SourceKind.TRADITIONAL_FACTOR, factors, () -> {
                    throw new SourceUnavailableException(SourceKind.TRADITIONAL_FACTOR, "Registry down");
                })));

        assertThat(items).hasSize(5).noneMatch(EvidenceItem::isAvailable);
        assertThat(items).extracting(EvidenceItem::getFactor).containsExactlyElementsOf(factors);
        assertThat(unavailableCount(SourceKind.TRADITIONAL_FACTOR)).isEqualTo(5.0);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fetchAll_executorSaturated_reportedUnavailable() {
        ExecutorService rejecting = mock(ExecutorService.class);
        when(rejecting.submit(any(java.util.concurrent.Callable.class)))
                .thenThrow(new RejectedExecutionException("full"));
        EvidenceFetcher saturated = new EvidenceFetcher(rejecting, config, Tracer.NOOP, new MetricsConfig(registry));

        List<EvidenceItem> items = saturated.fetchAll(List.of(
                EvidenceTask.single(SourceKind.ACTION, FactorNames.ACTION,
                        () -> availableItem(SourceKind.ACTION, FactorNames.ACTION, 10.0))));

        assertThat(items).singleElement().satisfies(item -> {
            assertThat(item.isAvailable()).isFalse();
            assertThat(item.getReason()).isEqualTo("evidence executor saturated");
        });
    }

    @Test
    void fetchAll_callerInterrupted_cancelsOutstandingAndThrows() throws Exception {
        config.getEvidence().setTimeoutMs(10_000);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch cancelled = new CountDownLatch(1);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        AtomicBoolean interruptFlagRestored = new AtomicBoolean();

        Thread caller = new Thread(() -> {
            try {
                fetcher.fetchAll(List.of(
                        EvidenceTask.single(SourceKind.SATELLITE, FactorNames.SATELLITE, () -> {
                            started.countDown();
                            try {
                                Thread.sleep(20_000);
                            } catch (InterruptedException e) {
                                cancelled.countDown();
                                throw e;
                            }
                            return availableItem(SourceKind.SATELLITE, FactorNames.SATELLITE, 100.0);
                        })));
            } catch (Throwable t) {
                thrown.set(t);
                interruptFlagRestored.set(Thread.currentThread().isInterrupted());
            }
        });
        caller.start();
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        caller.interrupt();
        caller.join(2_000);

        assertThat(thrown.get()).isInstanceOf(CancellationException.class);
        assertThat(interruptFlagRestored.get()).isTrue();
        assertThat(cancelled.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
