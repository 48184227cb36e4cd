package fr.lapetina.preferences.collector.pipeline.quality;

import fr.lapetina.preferences.collector.domain.model.ComparisonSubmission;

import java.util.List;
import java.util.Locale;

/**
 * First stage of ingestion: decides whether a comparison is worth storing.
 *
 * Rejects, first failing check wins:
 * - Prompt shorter than the minimum
 * - Either response shorter than the minimum or longer than the maximum (A before B)
 * - Shorter/longer response length ratio below the minimum
 * - Responses identical after trimming
 * - A response that mostly echoes the prompt
 * - Missing producer identifier or chosen side
 *
 * Pure and total: no state, no I/O, never throws.
 */
public final class QualityGate {

    private static final String CODE_FENCE = "```";
    private static final List<String> FORMATTING_MARKERS = List.of("**", "##", "- ", "1. ");

    private final Thresholds thresholds;

    public QualityGate(Thresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Creates a gate with the default thresholds.
     */
    public static QualityGate withDefaults() {
        return new QualityGate(Thresholds.defaults());
    }

    public Thresholds getThresholds() {
        return thresholds;
    }

    public QualityMetrics validate(ComparisonSubmission submission) {
        if (submission == null) {
            return new QualityMetrics(0, 0, 0, 0.0, false, false, 0.0,
                    false, QualityCheck.MISSING_SUBMISSION, "Submission is required");
        }

        String prompt = nullToEmpty(submission.prompt());
        String responseA = nullToEmpty(submission.responseA());
        String responseB = nullToEmpty(submission.responseB());

        int promptLength = length(prompt);
        int lengthA = length(responseA);
        int lengthB = length(responseB);
        int longer = Math.max(lengthA, lengthB);
        double lengthRatio = longer > 0 ? (double) Math.min(lengthA, lengthB) / longer : 0.0;

        boolean hasCode = responseA.contains(CODE_FENCE) || responseB.contains(CODE_FENCE);
        String combined = responseA + responseB;
        boolean hasFormatting = FORMATTING_MARKERS.stream().anyMatch(combined::contains);
        double latencyDifference = Math.abs(submission.latencyA() - submission.latencyB());

        QualityCheck failedCheck = null;
        String reason = "";
        try {
            check(submission, prompt, responseA, responseB, promptLength, lengthA, lengthB, lengthRatio);
        } catch (Rejection r) {
            failedCheck = r.check;
            reason = r.getMessage();
        }

        return new QualityMetrics(
                promptLength,
                lengthA,
                lengthB,
                lengthRatio,
                hasCode,
                hasFormatting,
                latencyDifference,
                failedCheck == null,
                failedCheck,
                reason
        );
    }

    private void check(
            ComparisonSubmission submission,
            String prompt,
            String responseA,
            String responseB,
            int promptLength,
            int lengthA,
            int lengthB,
            double lengthRatio
    ) throws Rejection {
        if (promptLength < thresholds.minPromptLength()) {
            throw new Rejection(QualityCheck.PROMPT_TOO_SHORT,
                    "Prompt too short (" + promptLength + " chars)");
        }

        if (lengthA < thresholds.minResponseLength()) {
            throw new Rejection(QualityCheck.RESPONSE_TOO_SHORT,
                    "Response A too short (" + lengthA + " chars)");
        }
        if (lengthB < thresholds.minResponseLength()) {
            throw new Rejection(QualityCheck.RESPONSE_TOO_SHORT,
                    "Response B too short (" + lengthB + " chars)");
        }

        if (lengthA > thresholds.maxResponseLength()) {
            throw new Rejection(QualityCheck.RESPONSE_TOO_LONG,
                    "Response A too long (" + lengthA + " chars)");
        }
        if (lengthB > thresholds.maxResponseLength()) {
            throw new Rejection(QualityCheck.RESPONSE_TOO_LONG,
                    "Response B too long (" + lengthB + " chars)");
        }

        if (lengthRatio < thresholds.minLengthRatio()) {
            throw new Rejection(QualityCheck.LENGTH_RATIO,
                    String.format(Locale.ROOT, "Response length ratio too skewed (%.2f)", lengthRatio));
        }

        if (responseA.strip().equals(responseB.strip())) {
            throw new Rejection(QualityCheck.IDENTICAL_RESPONSES, "Responses are identical");
        }

        String trimmedPrompt = prompt.strip();
        double echoLimit = promptLength * thresholds.echoRatio();
        if (responseA.contains(trimmedPrompt) && lengthA < echoLimit) {
            throw new Rejection(QualityCheck.PROMPT_ECHO, "Response A too similar to prompt");
        }
        if (responseB.contains(trimmedPrompt) && lengthB < echoLimit) {
            throw new Rejection(QualityCheck.PROMPT_ECHO, "Response B too similar to prompt");
        }

        if (submission.producerId() == null || submission.producerId().isBlank()) {
            throw new Rejection(QualityCheck.MISSING_PRODUCER, "Producer identifier is required");
        }

        if (submission.chosen() == null) {
            throw new Rejection(QualityCheck.MISSING_CHOICE, "Preference choice is required");
        }
    }

    // Characters, not UTF-16 units: an emoji counts once
    private static int length(String value) {
        return value.codePointCount(0, value.length());
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    /**
     * Gate thresholds. Lengths are in characters (Unicode code points).
     *
     * @param echoRatio a response containing the prompt is rejected when shorter than
     *                  this multiple of the prompt length
     */
    public record Thresholds(
            int minPromptLength,
            int minResponseLength,
            int maxResponseLength,
            double minLengthRatio,
            double echoRatio
    ) {
        public static final int DEFAULT_MIN_PROMPT_LENGTH = 10;
        public static final int DEFAULT_MIN_RESPONSE_LENGTH = 50;
        public static final int DEFAULT_MAX_RESPONSE_LENGTH = 10_000;
        public static final double DEFAULT_MIN_LENGTH_RATIO = 0.3;
        public static final double DEFAULT_ECHO_RATIO = 1.5;

        public Thresholds {
            if (minPromptLength < 0 || minResponseLength < 0) {
                throw new IllegalArgumentException("Minimum lengths must not be negative");
            }
            if (maxResponseLength < minResponseLength) {
                throw new IllegalArgumentException("Maximum response length must be >= minimum response length");
            }
            if (minLengthRatio < 0.0 || minLengthRatio > 1.0) {
                throw new IllegalArgumentException("Minimum length ratio must be between 0 and 1");
            }
        }

        public static Thresholds defaults() {
            return new Thresholds(
                    DEFAULT_MIN_PROMPT_LENGTH,
                    DEFAULT_MIN_RESPONSE_LENGTH,
                    DEFAULT_MAX_RESPONSE_LENGTH,
                    DEFAULT_MIN_LENGTH_RATIO,
                    DEFAULT_ECHO_RATIO
            );
        }
    }

    private static final class Rejection extends Exception {
        private final QualityCheck check;

        Rejection(QualityCheck check, String message) {
            super(message, null, false, false);
            this.check = check;
        }
    }
}
