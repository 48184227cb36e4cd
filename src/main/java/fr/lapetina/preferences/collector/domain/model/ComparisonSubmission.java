package fr.lapetina.preferences.collector.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A pairwise comparison handed to the collector by a producer.
 * Immutable and thread-safe.
 *
 * <p>Text fields are not validated here: a malformed submission is a normal
 * input for the quality gate, which rejects it with a specific reason.
 */
public record ComparisonSubmission(
        String prompt,
        String responseA,
        String responseB,
        Preference chosen,
        String domain,
        String category,
        String producerId,
        String sessionId,
        String responseAModel,
        String responseBModel,
        double latencyA,
        double latencyB,
        double confidence,
        Map<String, Object> context
) {
    public static final String DEFAULT_CATEGORY = "general";
    public static final double DEFAULT_CONFIDENCE = 1.0;

    public ComparisonSubmission {
        if (category == null || category.isBlank()) {
            category = DEFAULT_CATEGORY;
        }
        if (sessionId == null) {
            sessionId = "";
        }
        if (responseAModel == null) {
            responseAModel = "";
        }
        if (responseBModel == null) {
            responseBModel = "";
        }
        context = context != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(context))
                : Map.of();
    }

    /**
     * Returns a copy stamped with the given domain.
     */
    public ComparisonSubmission withDomain(String newDomain) {
        return new ComparisonSubmission(
                prompt, responseA, responseB, chosen, newDomain, category, producerId,
                sessionId, responseAModel, responseBModel, latencyA, latencyB, confidence, context
        );
    }

    /**
     * Creates a submission with only the required fields set.
     */
    public static ComparisonSubmission of(
            String prompt,
            String responseA,
            String responseB,
            Preference chosen,
            String producerId
    ) {
        return builder()
                .prompt(prompt)
                .responseA(responseA)
                .responseB(responseB)
                .chosen(chosen)
                .producerId(producerId)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String prompt;
        private String responseA;
        private String responseB;
        private Preference chosen;
        private String domain;
        private String category = DEFAULT_CATEGORY;
        private String producerId;
        private String sessionId = "";
        private String responseAModel = "";
        private String responseBModel = "";
        private double latencyA;
        private double latencyB;
        private double confidence = DEFAULT_CONFIDENCE;
        private Map<String, Object> context;

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder responseA(String responseA) {
            this.responseA = responseA;
            return this;
        }

        public Builder responseB(String responseB) {
            this.responseB = responseB;
            return this;
        }

        public Builder chosen(Preference chosen) {
            this.chosen = chosen;
            return this;
        }

        public Builder domain(String domain) {
            this.domain = domain;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder producerId(String producerId) {
            this.producerId = producerId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder responseAModel(String responseAModel) {
            this.responseAModel = responseAModel;
            return this;
        }

        public Builder responseBModel(String responseBModel) {
            this.responseBModel = responseBModel;
            return this;
        }

        public Builder latencyA(double latencyA) {
            this.latencyA = latencyA;
            return this;
        }

        public Builder latencyB(double latencyB) {
            this.latencyB = latencyB;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder context(Map<String, Object> context) {
            this.context = context;
            return this;
        }

        public ComparisonSubmission build() {
            return new ComparisonSubmission(
                    prompt, responseA, responseB, chosen, domain, category, producerId,
                    sessionId, responseAModel, responseBModel, latencyA, latencyB,
                    confidence, context
            );
        }
    }
}
