package com.questrail.agentsession.internal.log;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.questrail.agentsession.internal.effects.SessionEvent;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * SessionEventChannel
 * =============================================================================
 * A session's outbound event path: encode once, append to the bounded
 * {@link EventLog}, then fan out to live subscribers.
 *
 * <h2>Threading</h2>
 * {@link #publish(SessionEvent)} and {@link #attach(long, long)} are called
 * only from the owning actor's turn. Because both happen on the same turn
 * sequence, a replay batch computed by {@code attach} and the live stream that
 * follows it never overlap and never leave a gap.
 */
public final class SessionEventChannel
{
    /**
     * Result of attaching a subscriber.
     *
     * @param replay events after the requested revision, or empty if the
     *               request fell outside the buffered window
     * @param live   subscription receiving every event published afterwards
     */
    public record Attachment(Optional<List<LoggedEvent>> replay, Subscription<LoggedEvent> live) {}

    private final String sessionId;
    private final SessionEventCodec codec;
    private final EventLog log;
    private final Fanout<LoggedEvent> fanout;

    public SessionEventChannel(String sessionId,
                               SessionEventCodec codec,
                               EventLog log,
                               Fanout<LoggedEvent> fanout) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.log = Objects.requireNonNull(log, "log");
        this.fanout = Objects.requireNonNull(fanout, "fanout");
    }

    /**
     * Encodes, logs and delivers one event.
     *
     * @throws JsonProcessingException if the event cannot be encoded; nothing
     *         is logged or delivered in that case
     */
    public LoggedEvent publish(SessionEvent event) throws JsonProcessingException {
        if (!sessionId.equals(event.sessionId())) {
            throw new IllegalArgumentException("event for " + event.sessionId() + " on channel " + sessionId);
        }
        LoggedEvent entry = new LoggedEvent(event, codec.encode(event));
        log.append(entry);
        fanout.publish(entry);
        return entry;
    }

    /**
     * Attaches a live subscriber and computes its replay batch.
     */
    public Attachment attach(long sinceRevision, long currentRevision) {
        Optional<List<LoggedEvent>> replay = log.replaySince(sinceRevision, currentRevision);
        return new Attachment(replay, fanout.subscribe());
    }

    /**
     * Ends all live subscriptions.
     */
    public void close() {
        fanout.close();
    }

    public EventLog log() {
        return log;
    }

    public int subscriberCount() {
        return fanout.subscriberCount();
    }
}
