package com.example.threadcache.loadgen;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

/** Outcome of one workload run. Latencies are in microseconds. */
public class WorkloadReport {

    private final long operations;
    private final long hits;
    private final long misses;
    private final double meanMicros;
    private final double p95Micros;
    private final double p99Micros;
    private final double maxMicros;

    WorkloadReport(long hits, long misses, DescriptiveStatistics latencies) {
        this.operations = hits + misses;
        this.hits = hits;
        this.misses = misses;
        boolean empty = latencies.getN() == 0;
        this.meanMicros = empty ? 0.0 : latencies.getMean();
        this.p95Micros = empty ? 0.0 : latencies.getPercentile(95);
        this.p99Micros = empty ? 0.0 : latencies.getPercentile(99);
        this.maxMicros = empty ? 0.0 : latencies.getMax();
    }

    public long getOperations() {
        return operations;
    }

    public long getHits() {
        return hits;
    }

    public long getMisses() {
        return misses;
    }

    public double getHitRatio() {
        return operations == 0 ? 0.0 : hits / (double) operations;
    }

    public double getMeanMicros() {
        return meanMicros;
    }

    public double getP95Micros() {
        return p95Micros;
    }

    public double getP99Micros() {
        return p99Micros;
    }

    public double getMaxMicros() {
        return maxMicros;
    }

    @Override
    public String toString() {
        return String.format("Operations=%d, Hits=%d, Misses=%d, HitRatio=%.3f, Avg=%.2fus, P95=%.2fus, P99=%.2fus, Max=%.2fus",
            operations, hits, misses, getHitRatio(), meanMicros, p95Micros, p99Micros, maxMicros);
    }
}
