package com.smurthy.ai.chatrouter.observability;

import com.smurthy.ai.chatrouter.classifier.QueryLabel;
import com.smurthy.ai.chatrouter.retrieval.RetrievedDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Routing Observability Metrics
 *
 * Tracks how queries are routed and how the backends behave:
 * - Cycles per classification label
 * - Retrieval volume and failures
 * - Generation failures by kind (timeout / unavailable)
 * - End-to-end cycle latency
 * - Document usage patterns
 *
 * Exposed through /monitoring/routing.
 */
@Component
public class RoutingMetrics {

    private static final Logger log = LoggerFactory.getLogger(RoutingMetrics.class);

    private static final long SLOW_CYCLE_MS = 5000;

    // Counters
    private final LongAdder totalCycles = new LongAdder();
    private final Map<QueryLabel, LongAdder> cyclesByLabel = new EnumMap<>(QueryLabel.class);
    private final LongAdder totalRetrievals = new LongAdder();
    private final LongAdder retrievalFailures = new LongAdder();
    private final LongAdder totalDocumentsRetrieved = new LongAdder();
    private final LongAdder generationTimeouts = new LongAdder();
    private final LongAdder generationFailures = new LongAdder();

    // Timing metrics (in milliseconds)
    private final LongAdder totalLatencyMs = new LongAdder();
    private final AtomicLong maxLatencyMs = new AtomicLong(0);
    private final AtomicLong minLatencyMs = new AtomicLong(Long.MAX_VALUE);

    // Document usage tracking
    private final Map<String, LongAdder> documentRetrievalCounts = new ConcurrentHashMap<>();

    public RoutingMetrics() {
        // populated once so the map is never structurally modified afterwards
        for (QueryLabel label : QueryLabel.values()) {
            cyclesByLabel.put(label, new LongAdder());
        }
    }

    /**
     * Record a completed routing cycle
     */
    public void recordCycle(CycleMetricData data) {
        totalCycles.increment();
        cyclesByLabel.get(data.label()).increment();

        if (data.retrievalAttempted()) {
            totalRetrievals.increment();
            if (data.retrievalFailed()) {
                retrievalFailures.increment();
            }
        }

        if (data.retrievedDocuments() != null) {
            totalDocumentsRetrieved.add(data.retrievedDocuments().size());
            for (RetrievedDocument doc : data.retrievedDocuments()) {
                documentRetrievalCounts
                        .computeIfAbsent(doc.id(), k -> new LongAdder())
                        .increment();
            }
        }

        if (data.generationError() != null) {
            switch (data.generationError()) {
                case TIMEOUT -> generationTimeouts.increment();
                case UNAVAILABLE -> generationFailures.increment();
            }
        }

        totalLatencyMs.add(data.latencyMs());
        maxLatencyMs.updateAndGet(current -> Math.max(current, data.latencyMs()));
        minLatencyMs.updateAndGet(current -> Math.min(current, data.latencyMs()));

        if (data.latencyMs() > SLOW_CYCLE_MS) {
            log.warn("Slow routing cycle: {}ms on path {}", data.latencyMs(), data.path());
        }
    }

    /**
     * Get current metrics summary
     */
    public MetricsSummary getMetricsSummary() {
        long cycles = totalCycles.sum();
        long retrievals = totalRetrievals.sum();

        Map<String, Long> byLabel = new LinkedHashMap<>();
        for (QueryLabel label : QueryLabel.values()) {
            byLabel.put(label.name(), cyclesByLabel.get(label).sum());
        }

        return new MetricsSummary(
                cycles,
                byLabel,
                retrievals,
                retrievalFailures.sum(),
                totalDocumentsRetrieved.sum(),
                retrievals > 0 ? (double) totalDocumentsRetrieved.sum() / retrievals : 0,
                generationTimeouts.sum(),
                generationFailures.sum(),
                cycles > 0 ? totalLatencyMs.sum() / cycles : 0,
                maxLatencyMs.get(),
                minLatencyMs.get() == Long.MAX_VALUE ? 0 : minLatencyMs.get(),
                getMostRetrievedDocuments(5)
        );
    }

    /**
     * Reset all metrics
     */
    public void resetMetrics() {
        totalCycles.reset();
        cyclesByLabel.values().forEach(LongAdder::reset);
        totalRetrievals.reset();
        retrievalFailures.reset();
        totalDocumentsRetrieved.reset();
        generationTimeouts.reset();
        generationFailures.reset();
        totalLatencyMs.reset();
        maxLatencyMs.set(0);
        minLatencyMs.set(Long.MAX_VALUE);
        documentRetrievalCounts.clear();
        log.info("Routing metrics reset");
    }

    public void logMetricsSummary() {
        MetricsSummary summary = getMetricsSummary();
        log.info("""

                ╔═══════════════════════════════════════════════════════════════╗
                ║                ROUTING METRICS SUMMARY                        ║
                ╠═══════════════════════════════════════════════════════════════╣
                ║ Total Cycles:           {}
                ║ Cycles by Label:        {}
                ║ Retrievals:             {} ({} failed)
                ║ Avg Docs/Retrieval:     {}
                ║ Generation Timeouts:    {}
                ║ Generation Failures:    {}
                ║ Avg Latency:            {} ms
                ║ Max Latency:            {} ms
                ║ Min Latency:            {} ms
                ╚═══════════════════════════════════════════════════════════════╝
                """,
                summary.totalCycles(),
                summary.cyclesByLabel(),
                summary.totalRetrievals(),
                summary.retrievalFailures(),
                String.format("%.2f", summary.averageDocsPerRetrieval()),
                summary.generationTimeouts(),
                summary.generationFailures(),
                summary.averageLatencyMs(),
                summary.maxLatencyMs(),
                summary.minLatencyMs()
        );
    }

    private List<String> getMostRetrievedDocuments(int limit) {
        return documentRetrievalCounts.entrySet().stream()
                .sorted((e1, e2) -> Long.compare(e2.getValue().sum(), e1.getValue().sum()))
                .limit(limit)
                .map(e -> e.getKey() + " (" + e.getValue().sum() + " times)")
                .toList();
    }

    // Data classes

    public enum GenerationError {
        TIMEOUT, UNAVAILABLE
    }

    public record CycleMetricData(
            QueryLabel label,
            String path,
            long latencyMs,
            boolean retrievalAttempted,
            boolean retrievalFailed,
            List<RetrievedDocument> retrievedDocuments,
            GenerationError generationError
    ) {}

    public record MetricsSummary(
            long totalCycles,
            Map<String, Long> cyclesByLabel,
            long totalRetrievals,
            long retrievalFailures,
            long totalDocumentsRetrieved,
            double averageDocsPerRetrieval,
            long generationTimeouts,
            long generationFailures,
            long averageLatencyMs,
            long maxLatencyMs,
            long minLatencyMs,
            List<String> topRetrievedDocuments
    ) {}
}
