package com.williamcallahan.aivisibility.service;

import static com.williamcallahan.aivisibility.domain.analysis.AnalysisFixtures.ANALYZED_AT;
import static com.williamcallahan.aivisibility.domain.analysis.AnalysisFixtures.record;
import static org.junit.jupiter.api.Assertions.*;

import com.williamcallahan.aivisibility.domain.analysis.CategoryScores;
import com.williamcallahan.aivisibility.domain.analysis.ScoreRecord;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ConsistencyResolverTest {
    private static final String URL = "https://example.com/";

    private ThreadPoolTaskExecutor pooledExecutor;

    @AfterEach
    void tearDown() {
        if (pooledExecutor != null) {
            pooledExecutor.shutdown();
        }
    }

    private static ConsistencyResolver resolverFor(PageAnalyzer pageAnalyzer) {
        return new ConsistencyResolver(
                pageAnalyzer, new TaskExecutorAdapter(Runnable::run), ServiceTestSupport.fastProperties());
    }

    private ConsistencyResolver pooledResolverFor(PageAnalyzer pageAnalyzer) {
        pooledExecutor = new ThreadPoolTaskExecutor();
        pooledExecutor.setCorePoolSize(2);
        pooledExecutor.setMaxPoolSize(2);
        pooledExecutor.setThreadNamePrefix("resolver-test-");
        pooledExecutor.initialize();
        return new ConsistencyResolver(pageAnalyzer, pooledExecutor, ServiceTestSupport.fastProperties());
    }

    // Blocks until released or interrupted; counts interrupts
    private static ScoreRecord blockUntil(CountDownLatch release, CountDownLatch interrupted) {
        try {
            release.await(10, TimeUnit.SECONDS);
            return record(50, 50, 50, 50, 50, 50);
        } catch (InterruptedException interruptedWait) {
            interrupted.countDown();
            Thread.currentThread().interrupt();
            throw new PageAnalysisException("Analysis interrupted", interruptedWait);
        }
    }

    @Test
    @DisplayName("High variance resolves every score to the rounded mean")
    void mediatesHighVariance() {
        ScoreRecord first = record(50, 40, 60, 50, 70, 30);
        ScoreRecord second = record(68, 61, 62, 55, 70, 35);

        ConsistencyResolver.ConsistencyOutcome outcome =
                resolverFor(url -> first).resolve("https://example.com/", first, second);

        assertTrue(outcome.highVariance());
        assertEquals(21, outcome.maxVariance());
        assertEquals(59, outcome.result().overallScore());
        // 40 and 61 average to 50.5
        assertEquals(51, outcome.result().scores().aiLlmVisibility());
        assertEquals(61, outcome.result().scores().technical());
        assertEquals(53, outcome.result().scores().content());
        assertEquals(70, outcome.result().scores().accessibility());
        assertEquals(33, outcome.result().scores().authority());
        assertEquals(18, outcome.differences().get("overall"));
    }

    @Test
    @DisplayName("Low variance returns the first run unchanged")
    void keepsFirstRunWithinThreshold() {
        ScoreRecord first = record(71, 70, 72, 71, 70, 69);
        ScoreRecord second = record(74, 73, 75, 74, 73, 72);

        ConsistencyResolver.ConsistencyOutcome outcome =
                resolverFor(url -> first).resolve("https://example.com/", first, second);

        assertFalse(outcome.highVariance());
        assertSame(first, outcome.result());
    }

    @Test
    void varianceEqualToThresholdIsNotMediated() {
        ScoreRecord first = record(60, 60, 60, 60, 60, 60);
        ScoreRecord second = record(70, 70, 70, 70, 70, 70);

        assertSame(first, resolverFor(url -> first).resolve("https://example.com/", first, second).result());
    }

    @Test
    @DisplayName("The longer narrative survives mediation")
    void keepsLongerNarrative() {
        ScoreRecord first = new ScoreRecord(20, new CategoryScores(20, 20, 20, 20, 20), "short", null, ANALYZED_AT);
        ScoreRecord second = new ScoreRecord(80, new CategoryScores(80, 80, 80, 80, 80), "a much longer narrative",
                null, ANALYZED_AT);

        ScoreRecord resolved = resolverFor(url -> first).resolve("https://example.com/", first, second).result();

        assertEquals("a much longer narrative", resolved.narrativeReport());
    }

    @Test
    @DisplayName("Both runs are invoked and reconciled")
    void analyzeAsyncRunsTwice() {
        AtomicInteger calls = new AtomicInteger();
        ScoreRecord low = record(50, 50, 50, 50, 50, 50);
        ScoreRecord high = record(70, 70, 70, 70, 70, 70);
        ConsistencyResolver resolver = resolverFor(url -> calls.incrementAndGet() == 1 ? low : high);

        ScoreRecord resolved = resolver.analyzeAsync("https://example.com/").join();

        assertEquals(2, calls.get());
        assertEquals(60, resolved.overallScore());
    }

    @Test
    @DisplayName("A failing run fails the pair")
    void failingRunFailsPair() {
        AtomicInteger calls = new AtomicInteger();
        ConsistencyResolver resolver = resolverFor(url -> {
            if (calls.incrementAndGet() == 2) {
                throw new PageAnalysisException("403 Forbidden");
            }
            return record(50, 50, 50, 50, 50, 50);
        });

        CompletableFuture<ScoreRecord> pending = resolver.analyzeAsync("https://example.com/");

        CompletionException failure = assertThrows(CompletionException.class, pending::join);
        assertInstanceOf(PageAnalysisException.class, failure.getCause());
    }

    @Test
    @DisplayName("Equal narrative lengths keep the second run's narrative")
    void equalNarrativesKeepSecond() {
        ScoreRecord first = new ScoreRecord(20, new CategoryScores(20, 20, 20, 20, 20), "first", null, ANALYZED_AT);
        ScoreRecord second = new ScoreRecord(80, new CategoryScores(80, 80, 80, 80, 80), "other", null, ANALYZED_AT);

        ScoreRecord resolved = resolverFor(url -> first).resolve(URL, first, second).result();

        assertEquals("other", resolved.narrativeReport());
    }

    @Test
    @DisplayName("Both analyzer calls are in flight at the same time")
    void runsExecuteConcurrently() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        ConsistencyResolver resolver = pooledResolverFor(url -> {
            bothRunning.countDown();
            try {
                if (!bothRunning.await(5, TimeUnit.SECONDS)) {
                    throw new PageAnalysisException("second run never started");
                }
            } catch (InterruptedException interrupted) {
                Thread.currentThread().interrupt();
                throw new PageAnalysisException("Analysis interrupted", interrupted);
            }
            return record(64, 60, 60, 60, 60, 60);
        });

        ScoreRecord resolved = resolver.analyzeAsync(URL).get(10, TimeUnit.SECONDS);

        assertEquals(64, resolved.overallScore());
        assertEquals(0, bothRunning.getCount());
    }

    @Test
    @DisplayName("A failing run fails the pair while its sibling is still running")
    void failureCompletesPairBeforeSibling() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch siblingInterrupted = new CountDownLatch(1);
        ConsistencyResolver resolver = pooledResolverFor(url -> {
            if (calls.incrementAndGet() == 1) {
                return blockUntil(release, siblingInterrupted);
            }
            throw new PageAnalysisException("403 Forbidden");
        });

        CompletableFuture<ScoreRecord> pending = resolver.analyzeAsync(URL);

        ExecutionException failure = assertThrows(ExecutionException.class, () -> pending.get(5, TimeUnit.SECONDS));
        assertInstanceOf(PageAnalysisException.class, failure.getCause());
        assertEquals(1, release.getCount());
        assertTrue(siblingInterrupted.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Cancelling the pair interrupts both running analyses")
    void cancelInterruptsRuns() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(2);
        ConsistencyResolver resolver = pooledResolverFor(url -> {
            bothRunning.countDown();
            return blockUntil(release, interrupted);
        });

        CompletableFuture<ScoreRecord> pending = resolver.analyzeAsync(URL);
        assertTrue(bothRunning.await(5, TimeUnit.SECONDS));
        pending.cancel(true);

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        assertEquals(1, release.getCount());
    }
}
