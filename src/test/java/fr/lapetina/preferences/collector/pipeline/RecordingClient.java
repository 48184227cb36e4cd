package fr.lapetina.preferences.collector.pipeline;

import fr.lapetina.preferences.collector.domain.model.ErrorType;
import fr.lapetina.preferences.collector.domain.model.QueuedRecord;
import fr.lapetina.preferences.collector.infrastructure.http.RemoteClient;
import fr.lapetina.preferences.collector.infrastructure.http.SendResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-memory remote client for tests. Records every record it is asked to send.
 */
public class RecordingClient implements RemoteClient {

    private final List<QueuedRecord> received = new CopyOnWriteArrayList<>();
    private volatile Function<QueuedRecord, SendResult> behaviour;

    public RecordingClient() {
        this(record -> SendResult.success(record.recordId().substring(0, 8)));
    }

    public RecordingClient(Function<QueuedRecord, SendResult> behaviour) {
        this.behaviour = behaviour;
    }

    public static RecordingClient failing(ErrorType errorType) {
        return new RecordingClient(record -> SendResult.failure(errorType, "stubbed " + errorType));
    }

    public static RecordingClient throwing() {
        return new RecordingClient(record -> {
            throw new IllegalStateException("connection pool exhausted");
        });
    }

    @Override
    public SendResult send(QueuedRecord record) {
        received.add(record);
        return behaviour.apply(record);
    }

    public void setBehaviour(Function<QueuedRecord, SendResult> behaviour) {
        this.behaviour = behaviour;
    }

    public List<QueuedRecord> getReceived() {
        return received;
    }

    public int count() {
        return received.size();
    }
}
