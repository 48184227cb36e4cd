package fr.lapetina.preferences.collector.domain.model;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * An accepted submission waiting in the queue for transmission.
 *
 * <p>Carries the acceptance timestamp assigned by the collector and the
 * normalized domain and category the remote store files the record under.
 */
public record QueuedRecord(
        String recordId,
        ComparisonSubmission submission,
        String domain,
        String category,
        Instant acceptedAt
) {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public QueuedRecord {
        Objects.requireNonNull(submission, "Submission is required");
        if (recordId == null) {
            recordId = UUID.randomUUID().toString();
        }
        if (acceptedAt == null) {
            acceptedAt = Instant.now();
        }
        domain = normalize(domain, "");
        category = normalize(category, ComparisonSubmission.DEFAULT_CATEGORY);
    }

    /**
     * Creates a record for a submission accepted now.
     */
    public static QueuedRecord accept(ComparisonSubmission submission) {
        return new QueuedRecord(null, submission, submission.domain(), submission.category(), Instant.now());
    }

    /**
     * Trims, lower-cases and replaces whitespace runs with underscores.
     */
    public static String normalize(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return WHITESPACE.matcher(value.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    }
}
