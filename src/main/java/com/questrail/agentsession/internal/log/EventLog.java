package com.questrail.agentsession.internal.log;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * EventLog
 * =============================================================================
 * Bounded, append-only ring buffer of one session's emitted events.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Entries are held in strictly increasing, gap-free revision order</li>
 *   <li>At most {@code capacity} entries are held; the oldest is evicted first</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * Confined to the owning session actor. Appends and replay queries are both
 * made from the actor's turn, which is what keeps a replay batch and the
 * subsequent live attachment free of gaps and duplicates.
 */
public final class EventLog
{
    private final int capacity;
    private final ArrayDeque<LoggedEvent> entries;

    public EventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * Appends the next event. An entry that does not directly follow the
     * newest one (an event in between was never published) restarts the
     * buffer at that entry, so no replay can span the hole.
     *
     * @throws IllegalArgumentException if the revision goes backwards
     */
    public void append(LoggedEvent entry) {
        LoggedEvent newest = entries.peekLast();
        if (newest != null && entry.revision() <= newest.revision()) {
            throw new IllegalArgumentException(
                    "revision " + entry.revision() + " does not follow " + newest.revision());
        }
        if (newest != null && entry.revision() != newest.revision() + 1) {
            entries.clear();
        }
        if (entries.size() == capacity) {
            entries.pollFirst();
        }
        entries.addLast(entry);
    }

    /**
     * Returns the events a subscriber that last saw {@code sinceRevision}
     * is missing, or empty if they are no longer (or were never) buffered.
     *
     * <p>The window is served when {@code oldest - 1 <= since <= current}.
     * With nothing buffered, only a subscriber that is already current gets
     * an (empty) replay.</p>
     *
     * @param sinceRevision   last revision the subscriber has applied
     * @param currentRevision revision of the session right now
     */
    public Optional<List<LoggedEvent>> replaySince(long sinceRevision, long currentRevision) {
        if (sinceRevision > currentRevision || sinceRevision < 0) {
            return Optional.empty();
        }
        if (entries.isEmpty()) {
            return sinceRevision == currentRevision ? Optional.of(List.of()) : Optional.empty();
        }
        if (sinceRevision < entries.peekFirst().revision() - 1) {
            return Optional.empty();
        }

        List<LoggedEvent> out = new ArrayList<>();
        Iterator<LoggedEvent> it = entries.descendingIterator();
        while (it.hasNext()) {
            LoggedEvent e = it.next();
            if (e.revision() <= sinceRevision) {
                break;
            }
            out.add(e);
        }
        Collections.reverse(out);
        return Optional.of(List.copyOf(out));
    }

    /**
     * Returns every buffered event, oldest first.
     */
    public List<LoggedEvent> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Oldest buffered revision, or -1 when empty. */
    public long oldestRevision() {
        LoggedEvent first = entries.peekFirst();
        return first == null ? -1 : first.revision();
    }

    /** Newest buffered revision, or -1 when empty. */
    public long newestRevision() {
        LoggedEvent last = entries.peekLast();
        return last == null ? -1 : last.revision();
    }
}
