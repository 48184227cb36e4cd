package fr.lapetina.preferences.collector.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Side chosen by a producer when comparing two responses.
 */
public enum Preference {
    A,
    B,
    TIE;

    /**
     * Parses a choice label ("A", "b", " tie ").
     *
     * @return the matching choice, or empty if the label is null or unknown
     */
    public static Optional<Preference> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
