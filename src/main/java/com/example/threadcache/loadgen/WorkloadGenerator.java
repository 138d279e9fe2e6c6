package com.example.threadcache.loadgen;

import com.example.threadcache.core.ThreadCache;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a thread cache with a Zipfian key distribution. Every worker thread fetches keys through
 * its own store, counts per-key accesses with {@code increment}, and releases its store when done.
 */
public class WorkloadGenerator {

    private static final Logger log = LoggerFactory.getLogger(WorkloadGenerator.class);

    static final String NAMESPACE = "workload";

    private final int threads;
    private final int opsPerThread;
    private final int universe;
    private final double alpha;
    private final Duration expiresIn;
    private final long seed;

    public WorkloadGenerator(int threads, int opsPerThread, int universe, double alpha, Duration expiresIn, long seed) {
        if (threads <= 0 || opsPerThread < 0 || universe <= 0 || alpha <= 0) {
            throw new IllegalArgumentException(String.format(
                "Invalid workload (threads=%d, opsPerThread=%d, universe=%d, alpha=%.2f)",
                threads, opsPerThread, universe, alpha));
        }
        this.threads = threads;
        this.opsPerThread = opsPerThread;
        this.universe = universe;
        this.alpha = alpha;
        this.expiresIn = expiresIn;
        this.seed = seed;
    }

    public WorkloadReport run() throws InterruptedException {
        ThreadCache cache = ThreadCache.builder()
            .namespace(NAMESPACE)
            .expiresIn(expiresIn)
            .build();

        AtomicLong hits = new AtomicLong();
        AtomicLong misses = new AtomicLong();

        log.info("Starting workload (threads={}, opsPerThread={}, universe={}, alpha={}, expiresIn={})",
            threads, opsPerThread, universe, alpha, expiresIn);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<double[]>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                long workerSeed = seed + i;
                futures.add(executor.submit(() -> runWorker(cache, workerSeed, hits, misses)));
            }

            DescriptiveStatistics latencies = new DescriptiveStatistics();
            for (Future<double[]> future : futures) {
                for (double latency : future.get()) {
                    latencies.addValue(latency);
                }
            }

            WorkloadReport report = new WorkloadReport(hits.get(), misses.get(), latencies);
            log.info("Workload finished. {}", report);
            return report;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Workload worker failed", e.getCause());
        } finally {
            executor.shutdownNow();
            // building the cache created an empty store on this thread
            cache.release();
        }
    }

    int getThreads() {
        return threads;
    }

    int getOpsPerThread() {
        return opsPerThread;
    }

    int getUniverse() {
        return universe;
    }

    double getAlpha() {
        return alpha;
    }

    Duration getExpiresIn() {
        return expiresIn;
    }

    private double[] runWorker(ThreadCache cache, long workerSeed, AtomicLong hits, AtomicLong misses) {
        // ZipfDistribution sampling is not thread-safe, one per worker
        ZipfDistribution zipf = new ZipfDistribution(new Well19937c(workerSeed), universe, alpha);
        double[] latencies = new double[opsPerThread];
        boolean[] computed = new boolean[1];
        Function<String, Object> producer = key -> {
            computed[0] = true;
            return "value-for-" + key;
        };

        try {
            for (int op = 0; op < opsPerThread; op++) {
                String key = "key-" + zipf.sample();
                computed[0] = false;

                long start = System.nanoTime();
                cache.fetch(key, producer);
                cache.increment("count:" + key);
                latencies[op] = (System.nanoTime() - start) / 1_000.0;

                if (computed[0]) {
                    misses.incrementAndGet();
                } else {
                    hits.incrementAndGet();
                }
            }
        } finally {
            cache.release();
        }
        return latencies;
    }
}
