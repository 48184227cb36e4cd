package fr.lapetina.preferences.collector.infrastructure.http;

import fr.lapetina.preferences.collector.domain.model.ErrorType;

import java.util.Objects;

/**
 * Outcome of a single {@link RemoteClient#send} call.
 *
 * @param hash content hash assigned by the store on success, may be null
 */
public record SendResult(
        boolean success,
        String hash,
        ErrorType errorType,
        String error
) {
    public SendResult {
        if (!success) {
            Objects.requireNonNull(errorType, "Error type is required for a failed send");
        }
    }

    public static SendResult success(String hash) {
        return new SendResult(true, hash, null, null);
    }

    public static SendResult failure(ErrorType errorType, String error) {
        return new SendResult(false, null, errorType, error);
    }
}
