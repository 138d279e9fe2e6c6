package com.example.threadcache.loadgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.threadcache.core.ThreadCache;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class WorkloadGeneratorTest {

    @Test
    @DisplayName("Every operation is either a hit or a miss")
    void countsOperations() throws Exception {
        WorkloadReport report = new WorkloadGenerator(4, 500, 50, 1.1, null, 42L).run();

        assertThat(report.getOperations()).isEqualTo(2_000L);
        assertThat(report.getHits() + report.getMisses()).isEqualTo(2_000L);
        assertThat(report.getMaxMicros()).isGreaterThanOrEqualTo(report.getMeanMicros());
    }

    @Test
    @DisplayName("Without expiry each worker misses each distinct key at most once")
    void missesBoundedByUniverse() throws Exception {
        int threads = 2;
        int universe = 20;

        WorkloadReport report = new WorkloadGenerator(threads, 1_000, universe, 1.0, null, 7L).run();

        assertThat(report.getMisses()).isLessThanOrEqualTo((long) threads * universe);
        assertThat(report.getHitRatio()).isGreaterThan(0.9);
    }

    @Test
    @DisplayName("An immediate expiry turns every operation into a miss")
    void zeroExpiryAlwaysMisses() throws Exception {
        WorkloadReport report = new WorkloadGenerator(2, 200, 10, 1.0, Duration.ZERO, 1L).run();

        assertThat(report.getHits()).isZero();
        assertThat(report.getMisses()).isEqualTo(400L);
    }

    @Test
    void emptyRunReportsZeros() throws Exception {
        WorkloadReport report = new WorkloadGenerator(1, 0, 10, 1.0, null, 1L).run();

        assertThat(report.getOperations()).isZero();
        assertThat(report.getHitRatio()).isZero();
        assertThat(report.getP99Micros()).isZero();
    }

    @Test
    void rejectsInvalidWorkload() {
        assertThatThrownBy(() -> new WorkloadGenerator(0, 10, 10, 1.0, null, 1L))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Command-line arguments reach the generator")
    void parsesCommandLine() {
        WorkloadGenerator generator = WorkloadRunner.parse(new String[] {"2", " 10", "100", "0.9", "250"});

        assertThat(generator.getThreads()).isEqualTo(2);
        assertThat(generator.getOpsPerThread()).isEqualTo(10);
        assertThat(generator.getUniverse()).isEqualTo(100);
        assertThat(generator.getAlpha()).isEqualTo(0.9);
        assertThat(generator.getExpiresIn()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    @DisplayName("Expiry is off unless given on the command line")
    void parsesCommandLineWithoutExpiry() {
        WorkloadGenerator generator = WorkloadRunner.parse(new String[] {"1", "5", "10", "1.2"});

        assertThat(generator.getExpiresIn()).isNull();
    }

    @Test
    void rejectsBadCommandLine() {
        assertThatThrownBy(() -> WorkloadRunner.parse(new String[] {"two", "10", "100", "0.9"}))
            .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> WorkloadRunner.parse(new String[] {"0", "10", "100", "0.9"}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("The calling thread keeps no workload store after a run")
    void callingThreadKeepsNoStore() throws Exception {
        new WorkloadGenerator(1, 10, 5, 1.0, null, 3L).run();

        // Constructing a ThreadCache would allocate the store, so build it on another thread
        ThreadCache[] workload = new ThreadCache[1];
        Thread builder = new Thread(() -> {
            workload[0] = ThreadCache.builder().namespace(WorkloadGenerator.NAMESPACE).build();
            workload[0].release();
        });
        builder.start();
        builder.join();

        assertThat(workload[0].isAllocated()).isFalse();
    }
}
