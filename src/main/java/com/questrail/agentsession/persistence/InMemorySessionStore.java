package com.questrail.agentsession.persistence;

import com.questrail.agentsession.api.ApprovalRequest;
import com.questrail.agentsession.internal.effects.PersistOp;
import com.questrail.agentsession.internal.state.SessionState;
import com.questrail.agentsession.internal.state.WorkPhase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * InMemorySessionStore
 * =============================================================================
 * Reference {@link SessionStore} that folds writes into one record per session.
 *
 * <p>Useful for tests and for embedding the core without a database. The fold
 * mirrors what a relational store would do with the same write stream: rows
 * are created by {@link PersistOp.CreateSession} and updated in place by every
 * later operation. Writes for unknown sessions are rejected, and a batch
 * that contains a rejected write leaves the store unchanged.</p>
 *
 * <p>All methods are synchronized; the store is called from the single
 * persistence writer thread and, at startup, from the runtime.</p>
 */
public final class InMemorySessionStore implements SessionStore
{
    private final Map<String, SessionState> sessions = new LinkedHashMap<>();
    private final Map<String, ApprovalRequest> pendingApprovals = new HashMap<>();
    private final Map<String, List<String>> decisions = new HashMap<>();
    private final List<PersistenceWrite> journal = new ArrayList<>();

    @Override
    public synchronized void write(List<PersistenceWrite> batch) throws SessionStoreException {
        Map<String, SessionState> sessionsBefore = new LinkedHashMap<>(sessions);
        Map<String, ApprovalRequest> approvalsBefore = new HashMap<>(pendingApprovals);
        Map<String, List<String>> decisionsBefore = new HashMap<>();
        decisions.forEach((id, list) -> decisionsBefore.put(id, new ArrayList<>(list)));
        try {
            for (PersistenceWrite w : batch) {
                apply(w);
            }
        } catch (SessionStoreException | RuntimeException e) {
            sessions.clear();
            sessions.putAll(sessionsBefore);
            pendingApprovals.clear();
            pendingApprovals.putAll(approvalsBefore);
            decisions.clear();
            decisions.putAll(decisionsBefore);
            throw e;
        }
        journal.addAll(batch);
    }

    @Override
    public synchronized List<SessionState> loadActiveSessions() {
        List<SessionState> out = new ArrayList<>();
        for (SessionState s : sessions.values()) {
            if (!s.isEnded()) {
                out.add(s);
            }
        }
        return out;
    }

    public synchronized Optional<SessionState> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Every write applied so far, in order.
     */
    public synchronized List<PersistenceWrite> journal() {
        return List.copyOf(journal);
    }

    /**
     * Decisions recorded for a session, in order ({@code "approved"},
     * {@code "denied"}, {@code "answered"} and so on).
     */
    public synchronized List<String> decisions(String sessionId) {
        return List.copyOf(decisions.getOrDefault(sessionId, Collections.emptyList()));
    }

    // ---------------------------------------------------------------------
    // Fold
    // ---------------------------------------------------------------------

    private void apply(PersistenceWrite w) throws SessionStoreException {
        PersistOp op = w.op();
        if (op instanceof PersistOp.CreateSession c) {
            if (!c.state().id().equals(w.sessionId())) {
                throw new SessionStoreException("create for " + c.state().id() + " addressed to " + w.sessionId());
            }
            sessions.put(w.sessionId(), c.state());
            return;
        }

        SessionState s = sessions.get(w.sessionId());
        if (s == null) {
            throw new SessionStoreException("Unknown session " + w.sessionId());
        }

        SessionState updated;
        if (op instanceof PersistOp.AppendMessage m) {
            updated = s.withMessageAppended(m.message());
        } else if (op instanceof PersistOp.UpdateMessage m) {
            updated = s.withMessageUpdated(m.messageId(), m.changes());
        } else if (op instanceof PersistOp.UpdateSessionStatus st) {
            updated = withWorkStatus(s, st).withTurn(st.currentTurnId(), st.turnCount())
                    .withLastActivityAt(st.lastActivityAt());
        } else if (op instanceof PersistOp.UpdateMetadata m) {
            updated = s.withMetadata(m.metadata());
        } else if (op instanceof PersistOp.UpdateTokenUsage t) {
            updated = s.withTokenUsage(t.usage());
        } else if (op instanceof PersistOp.UpdateTurnState t) {
            updated = s.withCurrentDiff(t.currentDiff())
                    .withCurrentPlan(t.currentPlan())
                    .withTurn(t.currentTurnId(), t.turnCount());
        } else if (op instanceof PersistOp.RecordApprovalRequest r) {
            pendingApprovals.put(w.sessionId(), r.request());
            updated = s;
        } else if (op instanceof PersistOp.RecordApprovalDecision d) {
            pendingApprovals.remove(w.sessionId());
            decisions.computeIfAbsent(w.sessionId(), k -> new ArrayList<>()).add(d.decision());
            updated = s;
        } else if (op instanceof PersistOp.InsertTurnDiff t) {
            updated = s.withTurnDiffRecorded(t.turnDiff());
        } else if (op instanceof PersistOp.EndSession e) {
            pendingApprovals.remove(w.sessionId());
            updated = s.withPhase(new WorkPhase.Ended(e.reason())).withLastActivityAt(e.endedAt());
        } else if (op instanceof PersistOp.ReactivateSession r) {
            updated = s.withPhase(WorkPhase.idle()).withLastActivityAt(r.reactivatedAt());
        } else {
            throw new SessionStoreException("Unsupported write " + op.getClass().getSimpleName());
        }
        sessions.put(w.sessionId(), updated.withRevision(Math.max(updated.revision(), w.revision())));
    }

    private SessionState withWorkStatus(SessionState s, PersistOp.UpdateSessionStatus st) {
        return switch (st.workStatus()) {
            case WORKING -> s.withPhase(WorkPhase.working());
            case WAITING -> s.withPhase(WorkPhase.idle());
            case PERMISSION, QUESTION -> {
                ApprovalRequest pending = pendingApprovals.get(s.id());
                yield pending != null ? s.awaiting(pending) : s;
            }
            case ENDED -> s;
        };
    }
}
