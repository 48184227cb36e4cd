package fr.lapetina.preferences.collector.pipeline.quality;

/**
 * Quality checks in the order the gate applies them.
 * Used as the metrics tag for rejections.
 */
public enum QualityCheck {
    MISSING_SUBMISSION,
    PROMPT_TOO_SHORT,
    RESPONSE_TOO_SHORT,
    RESPONSE_TOO_LONG,
    LENGTH_RATIO,
    IDENTICAL_RESPONSES,
    PROMPT_ECHO,
    MISSING_PRODUCER,
    MISSING_CHOICE
}
