package fr.lapetina.preferences.collector.pipeline.quality;

/**
 * Verdict and measurements produced by {@link QualityGate} for one submission.
 * Discarded once the collector has decided to accept or reject.
 *
 * @param failedCheck     the first check that failed, or null when valid
 * @param rejectionReason human-readable reason, empty when valid
 */
public record QualityMetrics(
        int promptLength,
        int responseALength,
        int responseBLength,
        double lengthRatio,
        boolean hasCode,
        boolean hasFormatting,
        double latencyDifference,
        boolean valid,
        QualityCheck failedCheck,
        String rejectionReason
) {
    public QualityMetrics {
        if (rejectionReason == null) {
            rejectionReason = "";
        }
    }

    public boolean isValid() {
        return valid;
    }
}
