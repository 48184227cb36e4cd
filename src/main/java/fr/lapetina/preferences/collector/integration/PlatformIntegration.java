package fr.lapetina.preferences.collector.integration;

import fr.lapetina.preferences.collector.domain.model.CollectorStats;
import fr.lapetina.preferences.collector.domain.model.ComparisonSubmission;
import fr.lapetina.preferences.collector.domain.model.Preference;
import fr.lapetina.preferences.collector.pipeline.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for platform adapters.
 *
 * An adapter owns one collector bound to the platform's domain and turns
 * platform events into comparisons with a platform-specific prompt and category.
 * Choice labels arrive as strings ("A", "B", "TIE"); an unknown label leaves
 * the choice empty and the quality gate rejects the comparison.
 */
public abstract class PlatformIntegration implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PlatformIntegration.class);

    private final Collector collector;

    protected PlatformIntegration(String domain, Collector.Builder builder) {
        this.collector = builder.domain(domain).build();
        log.info("Platform integration ready: platform={}, domain={}", getClass().getSimpleName(), domain);
    }

    protected boolean record(
            String prompt,
            String responseA,
            String responseB,
            String selected,
            String userId,
            String category
    ) {
        Preference chosen = Preference.fromLabel(selected).orElse(null);
        if (chosen == null) {
            log.debug("Unrecognized choice label: domain={}, userId={}, label={}",
                    collector.getDomain(), userId, selected);
        }
        return collector.submit(ComparisonSubmission.builder()
                .prompt(prompt)
                .responseA(responseA)
                .responseB(responseB)
                .chosen(chosen)
                .producerId(userId)
                .category(category)
                .build());
    }

    public CollectorStats stats() {
        return collector.stats();
    }

    public int flush() {
        return collector.flush();
    }

    public Collector getCollector() {
        return collector;
    }

    public void stop() {
        collector.stop();
    }

    @Override
    public void close() {
        stop();
    }
}
