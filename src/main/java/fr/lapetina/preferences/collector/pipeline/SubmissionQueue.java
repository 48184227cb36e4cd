package fr.lapetina.preferences.collector.pipeline;

import fr.lapetina.preferences.collector.domain.model.QueuedRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * FIFO buffer of accepted records awaiting transmission.
 *
 * Push and pop share one lock. Depth stays near the collector's batch size
 * because crossing it makes the pushing producer drain the queue itself.
 */
public final class SubmissionQueue {

    private final Deque<QueuedRecord> records = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Appends a record and returns the depth including it.
     */
    public int push(QueuedRecord record) {
        lock.lock();
        try {
            records.addLast(record);
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the oldest record, or returns empty if the queue is drained.
     */
    public Optional<QueuedRecord> poll() {
        lock.lock();
        try {
            return Optional.ofNullable(records.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
