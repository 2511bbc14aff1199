package com.questrail.agentsession.registry;

import com.questrail.agentsession.api.SessionRoutingException;
import com.questrail.agentsession.api.SessionSummary;
import com.questrail.agentsession.internal.events.ClientCommand;
import com.questrail.agentsession.internal.events.SessionInput;
import com.questrail.agentsession.internal.exec.SessionHandle;
import com.questrail.agentsession.internal.exec.SubscribeResult;
import com.questrail.agentsession.internal.log.Fanout;
import com.questrail.agentsession.internal.state.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * SessionRegistry
 * =============================================================================
 * Concurrent index from session id to {@link SessionHandle}.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Backed by a {@link ConcurrentHashMap}: lookups never lock, updates lock
 *       a single bin</li>
 *   <li>Every operation performs at most one map access; routing, snapshots
 *       and subscriptions then talk to the handle outside the map</li>
 *   <li>Registration, removal and list subscription additionally hold the
 *       membership lock, so list events are published in map order and a
 *       new list subscriber's snapshot lines up with its first event</li>
 *   <li>No operation waits on an actor, so a stalled session delays nobody
 *       but its own callers</li>
 * </ul>
 *
 * <h2>Errors</h2>
 * Routing failures are thrown synchronously as {@link SessionRoutingException}:
 * {@code NOT_FOUND} for unknown ids, {@code ENDED} for inputs other than a
 * resume sent to an ended session, {@code BUSY} and {@code CLOSED} from the
 * handle itself.
 */
public final class SessionRegistry
{
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, SessionHandle> sessions = new ConcurrentHashMap<>();
    private final Fanout<SessionListEvent> listFanout;
    private final Object membershipLock = new Object();

    public SessionRegistry(int listBufferSize) {
        this.listFanout = new Fanout<>(listBufferSize,
                sub -> log.info("Dropped lagging session list subscriber (buffer {})", listBufferSize));
    }

    /**
     * Adds a session.
     *
     * @throws IllegalStateException if a session with the same id is registered
     */
    public void register(SessionHandle handle) {
        Objects.requireNonNull(handle, "handle");
        synchronized (membershipLock) {
            SessionHandle existing = sessions.putIfAbsent(handle.sessionId(), handle);
            if (existing != null) {
                throw new IllegalStateException("Session already registered: " + handle.sessionId());
            }
            listFanout.publish(new SessionListEvent.Registered(handle.snapshot().summary()));
        }
    }

    /**
     * Removes a session. Removing an unknown id is a no-op.
     *
     * @return the removed handle, if any
     */
    public Optional<SessionHandle> remove(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        synchronized (membershipLock) {
            SessionHandle removed = sessions.remove(sessionId);
            if (removed != null) {
                listFanout.publish(new SessionListEvent.Removed(sessionId));
            }
            return Optional.ofNullable(removed);
        }
    }

    /**
     * Removes a session only if it is still registered with this handle.
     */
    public boolean remove(String sessionId, SessionHandle handle) {
        synchronized (membershipLock) {
            if (sessions.remove(sessionId, handle)) {
                listFanout.publish(new SessionListEvent.Removed(sessionId));
                return true;
            }
            return false;
        }
    }

    /**
     * Routes an input into the session's inbox without waiting for it.
     */
    public void send(String sessionId, SessionInput input) throws SessionRoutingException {
        Objects.requireNonNull(input, "input");
        SessionHandle handle = require(sessionId);
        if (handle.snapshot().isEnded() && !(input instanceof ClientCommand.Resume)) {
            throw new SessionRoutingException(sessionId, SessionRoutingException.Reason.ENDED);
        }
        handle.tell(input);
    }

    /**
     * Last state published by the session's actor.
     */
    public SessionState snapshot(String sessionId) throws SessionRoutingException {
        return require(sessionId).snapshot();
    }

    /**
     * Summaries of every registered session, oldest first.
     */
    public List<SessionSummary> list() {
        List<SessionSummary> out = new ArrayList<>(sessions.size());
        for (SessionHandle handle : sessions.values()) {
            out.add(handle.snapshot().summary());
        }
        out.sort(Comparator.comparing(SessionSummary::startedAt).thenComparing(SessionSummary::id));
        return out;
    }

    /**
     * Subscribes to one session from the given revision.
     */
    public CompletableFuture<SubscribeResult> subscribe(String sessionId, long sinceRevision)
            throws SessionRoutingException {
        return require(sessionId).subscribe(sinceRevision);
    }

    /**
     * Subscribes to registrations and removals.
     */
    public ListSubscription subscribeList() {
        synchronized (membershipLock) {
            var live = listFanout.subscribe();
            return new ListSubscription(list(), live);
        }
    }

    public Optional<SessionHandle> handle(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public List<SessionHandle> handles() {
        return List.copyOf(sessions.values());
    }

    public boolean contains(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int size() {
        return sessions.size();
    }

    /**
     * Ends all list subscriptions.
     */
    public void close() {
        listFanout.close();
    }

    private SessionHandle require(String sessionId) throws SessionRoutingException {
        Objects.requireNonNull(sessionId, "sessionId");
        SessionHandle handle = sessions.get(sessionId);
        if (handle == null) {
            throw new SessionRoutingException(sessionId, SessionRoutingException.Reason.NOT_FOUND);
        }
        return handle;
    }
}
