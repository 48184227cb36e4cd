package fr.lapetina.preferences.collector.domain.model;

/**
 * Point-in-time snapshot of a collector's counters.
 *
 * <p>When no submission or send is in flight,
 * {@code collected == submitted + rejectedQuality + rejectedDuplicate + failed + queueDepth}.
 */
public record CollectorStats(
        long collected,
        long submitted,
        long rejectedQuality,
        long rejectedDuplicate,
        long failed,
        int queueDepth
) {

    /**
     * Share of collected submissions that reached the remote store.
     */
    public double acceptanceRate() {
        return collected > 0 ? (double) submitted / collected : 0.0;
    }

    /**
     * Sum of all terminal outcomes plus records still queued.
     */
    public long accountedFor() {
        return submitted + rejectedQuality + rejectedDuplicate + failed + queueDepth;
    }
}
