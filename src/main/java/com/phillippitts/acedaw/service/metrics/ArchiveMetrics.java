package com.phillippitts.acedaw.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for archive export and import.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Export/import counts by outcome (success, or the failure's exception name)</li>
 *   <li>Archive size distribution per direction</li>
 *   <li>Export/import latency</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class ArchiveMetrics {

    private static final String METRIC_PREFIX = "acedaw.archive";

    public static final String EXPORT = "export";
    public static final String IMPORT = "import";
    public static final String SUCCESS = "success";

    private final MeterRegistry registry;

    public ArchiveMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts one export or import attempt.
     *
     * @param direction {@link #EXPORT} or {@link #IMPORT}
     * @param outcome   {@link #SUCCESS} or a failure reason
     */
    public void incrementOutcome(String direction, String outcome) {
        Counter.builder(METRIC_PREFIX + "." + direction)
                .description("Number of archive " + direction + " attempts")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Records the size of an archive that was produced or accepted.
     */
    public void recordSize(String direction, long bytes) {
        DistributionSummary.builder(METRIC_PREFIX + ".size")
                .description("Archive size in bytes")
                .baseUnit("bytes")
                .tag("direction", direction)
                .register(registry)
                .record(bytes);
    }

    /**
     * Records how long an export or import took.
     */
    public void recordLatency(String direction, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to build or restore an archive")
                .tag("direction", direction)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
