package com.example.threadcache.loadgen;

import java.time.Duration;

/**
 * Command-line entry point for {@link WorkloadGenerator}.
 * Usage: WorkloadRunner &lt;threads&gt; &lt;opsPerThread&gt; &lt;universe&gt; &lt;alpha&gt; [expiresInMillis]
 * Example: WorkloadRunner 8 100000 10000 0.9 250
 */
public class WorkloadRunner {

    public static void main(String[] args) throws Exception {
        if (args.length < 4) {
            System.out.println("Usage: WorkloadRunner <threads> <opsPerThread> <universe> <alpha> [expiresInMillis]");
            System.out.println("Example: WorkloadRunner 8 100000 10000 0.9 250");
            return;
        }

        WorkloadReport report = parse(args).run();
        System.out.println(report);
    }

    static WorkloadGenerator parse(String[] args) {
        int threads = Integer.parseInt(args[0].trim());
        int opsPerThread = Integer.parseInt(args[1].trim());
        int universe = Integer.parseInt(args[2].trim());
        double alpha = Double.parseDouble(args[3].trim());
        // no expiry unless given
        Duration expiresIn = args.length > 4 ? Duration.ofMillis(Long.parseLong(args[4].trim())) : null;

        return new WorkloadGenerator(threads, opsPerThread, universe, alpha, expiresIn, System.nanoTime());
    }
}
