package org.orbitjump.warp.navigation;

import org.orbitjump.warp.context.Destination;
import org.orbitjump.warp.core.CommitResult;

/**
 * Result of a selection click.
 *
 * @param kind what happened.
 * @param picked destination under the cursor, or {@code null}.
 * @param commit commit outcome when a warp was attempted, or {@code null}.
 */
public record SelectionOutcome(Kind kind, Destination picked, CommitResult commit) {

    /**
     * Selection click outcomes.
     */
    public enum Kind {
        /** Selection mode was not active. */
        NOT_SELECTING,
        /** No discovered destination under the cursor. */
        NOTHING_PICKED,
        /** Picked but not affordable; the pick stays highlighted. */
        HIGHLIGHTED,
        /** Picked and committed. */
        COMMITTED
    }

    static SelectionOutcome notSelecting() {
        return new SelectionOutcome(Kind.NOT_SELECTING, null, null);
    }

    static SelectionOutcome nothingPicked() {
        return new SelectionOutcome(Kind.NOTHING_PICKED, null, null);
    }

    static SelectionOutcome highlighted(Destination picked) {
        return new SelectionOutcome(Kind.HIGHLIGHTED, picked, null);
    }

    static SelectionOutcome committed(Destination picked, CommitResult commit) {
        return new SelectionOutcome(Kind.COMMITTED, picked, commit);
    }
}
