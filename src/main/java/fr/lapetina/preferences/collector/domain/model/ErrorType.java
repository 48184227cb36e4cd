package fr.lapetina.preferences.collector.domain.model;

/**
 * Error taxonomy for record transmission.
 * The collector counts every category as a failed send; the split exists for logs and metrics.
 */
public enum ErrorType {
    /** Store rejected the record (4xx: validation, authentication) */
    CLIENT_ERROR,

    /** Store unreachable or failed internally (5xx, connection refused, I/O) */
    STORE_ERROR,

    /** No response within the request timeout */
    TIMEOUT,

    /** Circuit breaker is open; the call was not attempted */
    CIRCUIT_OPEN,

    /** Record could not be encoded into a request body */
    SERIALIZATION_ERROR,

    /** Anything else */
    INTERNAL_ERROR
}
