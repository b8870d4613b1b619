package com.quotagate.benchmark;

import com.quotagate.algorithms.TokenBucketRateLimiter;
import com.quotagate.config.RateLimitRuleRegistry;
import com.quotagate.core.RateLimitRule;
import com.quotagate.core.RateLimitScope;
import com.quotagate.core.RateLimiter;
import com.quotagate.core.RequestContext;
import com.quotagate.core.ScopeKeyBuilder;
import com.quotagate.observability.LoggingAuditSink;
import com.quotagate.observability.MetricsEventPublisher;
import com.quotagate.storage.AtomicBucketStore;
import com.quotagate.storage.InMemoryBucketStore;
import com.quotagate.storage.RedisBucketStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfEnvironmentVariable;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Throughput and latency of admission checks.
 *
 * Run these with Redis running locally:
 *   docker run -d -p 6379:6379 redis:alpine
 *
 * Enable with: export RUN_BENCHMARKS=true
 */
@EnabledIfEnvironmentVariable(named = "RUN_BENCHMARKS", matches = "true")
public class RateLimiterBenchmark {

    private static RedisBucketStore redisStore;
    private static SimpleMeterRegistry meterRegistry;

    @BeforeAll
    static void setup() {
        redisStore = new RedisBucketStore(
                RedisBucketStore.createPool("localhost", 6379, null, 0, Duration.ofMillis(50), 64, 16, 8),
                "bench:", Duration.ofSeconds(60));
        meterRegistry = new SimpleMeterRegistry();

        if (!redisStore.isAvailable()) {
            throw new IllegalStateException("Redis not available. Start with: docker run -p 6379:6379 redis:alpine");
        }

        System.out.println("=".repeat(80));
        System.out.println("TOKEN BUCKET ADMISSION BENCHMARKS");
        System.out.println("=".repeat(80));
    }

    @AfterAll
    static void tearDown() {
        redisStore.close();
    }

    private static RateLimiter limiter(AtomicBucketStore store, RateLimitScope scope) {
        RateLimitRule rule = RateLimitRule.builder()
                .operationId("bench")
                .capacity(1_000_000)
                .refillRatePerMinute(600_000.0)
                .scope(scope)
                .build();
        return new TokenBucketRateLimiter(
                RateLimitRuleRegistry.of(List.of(rule)),
                new ScopeKeyBuilder(false),
                store,
                List.of(new MetricsEventPublisher(meterRegistry)),
                new LoggingAuditSink(),
                Clock.systemUTC(),
                true);
    }

    @Test
    void benchmarkRedis_SingleKey() throws Exception {
        printResults(runBenchmark("Redis (GLOBAL key, 10 threads)",
                limiter(redisStore, RateLimitScope.GLOBAL), false, 10, 5_000));
    }

    @Test
    void benchmarkRedis_KeyPerThread() throws Exception {
        printResults(runBenchmark("Redis (USER key per thread, 20 threads)",
                limiter(redisStore, RateLimitScope.USER), true, 20, 2_000));
    }

    @Test
    void benchmarkInMemory_SingleKey() throws Exception {
        InMemoryBucketStore store = new InMemoryBucketStore(Duration.ofSeconds(60), 10_000);
        printResults(runBenchmark("In-memory (GLOBAL key, 10 threads)",
                limiter(store, RateLimitScope.GLOBAL), false, 10, 50_000));
    }

    private BenchmarkResult runBenchmark(String name, RateLimiter limiter, boolean keyPerThread,
                                         int numThreads, int requestsPerThread) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch endLatch = new CountDownLatch(numThreads);
        AtomicLong allowedCount = new AtomicLong();
        List<Long> latencies = Collections.synchronizedList(new ArrayList<>(numThreads * requestsPerThread));

        for (int t = 0; t < numThreads; t++) {
            RequestContext context = keyPerThread
                    ? RequestContext.ofPrincipal("user" + t)
                    : RequestContext.ofPrincipal("shared");
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int i = 0; i < requestsPerThread; i++) {
                        long start = System.nanoTime();
                        if (limiter.check("bench", context).isAllowed()) {
                            allowedCount.incrementAndGet();
                        }
                        latencies.add(System.nanoTime() - start);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    endLatch.countDown();
                }
            });
        }

        long startTime = System.currentTimeMillis();
        startLatch.countDown();
        endLatch.await();
        long durationMs = Math.max(1, System.currentTimeMillis() - startTime);
        executor.shutdown();

        long totalRequests = (long) numThreads * requestsPerThread;
        List<Long> sorted = new ArrayList<>(latencies);
        sorted.sort(Long::compareTo);
        double avgLatencyUs = sorted.stream().mapToLong(Long::longValue).average().orElse(0) / 1000.0;

        return new BenchmarkResult(
                name,
                totalRequests,
                allowedCount.get(),
                durationMs,
                (totalRequests * 1000) / durationMs,
                avgLatencyUs,
                sorted.get(sorted.size() / 2) / 1000,
                sorted.get((int) (sorted.size() * 0.95)) / 1000,
                sorted.get((int) (sorted.size() * 0.99)) / 1000);
    }

    private void printResults(BenchmarkResult result) {
        System.out.println("\n" + "-".repeat(80));
        System.out.println(result.name);
        System.out.println("-".repeat(80));
        System.out.printf("Total Requests:  %,d%n", result.totalRequests);
        System.out.printf("Allowed:         %,d (%.1f%%)%n",
                result.allowed, 100.0 * result.allowed / result.totalRequests);
        System.out.printf("Duration:        %,d ms%n", result.durationMs);
        System.out.printf("Throughput:      %,d req/sec%n", result.throughput);
        System.out.printf("Avg Latency:     %.2f us%n", result.avgLatencyUs);
        System.out.printf("Latency p50:     %,d us%n", result.p50);
        System.out.printf("Latency p95:     %,d us%n", result.p95);
        System.out.printf("Latency p99:     %,d us%n", result.p99);
    }

    private static class BenchmarkResult {
        final String name;
        final long totalRequests;
        final long allowed;
        final long durationMs;
        final long throughput;
        final double avgLatencyUs;
        final long p50;
        final long p95;
        final long p99;

        BenchmarkResult(String name, long totalRequests, long allowed, long durationMs,
                        long throughput, double avgLatencyUs, long p50, long p95, long p99) {
            this.name = name;
            this.totalRequests = totalRequests;
            this.allowed = allowed;
            this.durationMs = durationMs;
            this.throughput = throughput;
            this.avgLatencyUs = avgLatencyUs;
            this.p50 = p50;
            this.p95 = p95;
            this.p99 = p99;
        }
    }
}
