package fr.lapetina.preferences.collector.infrastructure.http;

import fr.lapetina.preferences.collector.domain.model.QueuedRecord;

/**
 * Transport that delivers one accepted record to the remote preference store.
 *
 * <p>Implementations make a single synchronous attempt and may block on network I/O.
 * Failures should be reported through {@link SendResult#failure}; an unchecked
 * exception is tolerated and counted as a failed send by the collector.
 */
@FunctionalInterface
public interface RemoteClient {

    SendResult send(QueuedRecord record);
}
