package com.questrail.agentsession.internal.effects;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Effects
 * -----------------------------------------------------------------------------
 * Immutable, ordered list of {@link Effect}s produced by one transition step.
 *
 * <h2>Role in the architecture</h2>
 * {@code Effects} is the bridge between pure session logic and the
 * side-effecting executor. The transition function decides <b>what</b> should
 * happen; the actor decides <b>when</b>, executing effects strictly in list
 * order.
 *
 * <h2>Revisions</h2>
 * {@link Builder#emit(EventPayload)} assigns revisions as it goes, starting at
 * {@code baseRevision + 1}. A step therefore advances the session revision by
 * exactly {@link #emitCount()}.
 */
public final class Effects
{
    private static final Effects NONE = new Effects(List.of(), 0);

    private final List<Effect> effects;
    private final int emitCount;

    private Effects(List<Effect> effects, int emitCount) {
        this.effects = effects;
        this.emitCount = emitCount;
    }

    public static Effects none() {
        return NONE;
    }

    public static Builder builder(long baseRevision, Instant timestamp) {
        return new Builder(baseRevision, timestamp);
    }

    public List<Effect> list() {
        return effects;
    }

    public boolean isEmpty() {
        return effects.isEmpty();
    }

    public int size() {
        return effects.size();
    }

    public int emitCount() {
        return emitCount;
    }

    /**
     * Returns the effects of the given type, in order.
     */
    public <T extends Effect> List<T> ofType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (Effect e : effects) {
            if (type.isInstance(e)) {
                out.add(type.cast(e));
            }
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Effects other)) return false;
        return effects.equals(other.effects);
    }

    @Override
    public int hashCode() {
        return effects.hashCode();
    }

    @Override
    public String toString() {
        return "Effects" + effects;
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder
    {
        private final List<Effect> effects = new ArrayList<>();
        private final Instant timestamp;
        private long nextRevision;
        private int emitCount;

        private Builder(long baseRevision, Instant timestamp) {
            this.nextRevision = baseRevision + 1;
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        public Builder persist(PersistOp op) {
            effects.add(new Effect.Persist(op));
            return this;
        }

        public Builder emit(EventPayload payload) {
            effects.add(new Effect.Emit(nextRevision++, timestamp, payload));
            emitCount++;
            return this;
        }

        public Builder runtimeCall(RuntimeCommand command) {
            effects.add(new Effect.RuntimeCall(command));
            return this;
        }

        public Effects build() {
            if (effects.isEmpty()) {
                return NONE;
            }
            return new Effects(Collections.unmodifiableList(new ArrayList<>(effects)), emitCount);
        }
    }
}
