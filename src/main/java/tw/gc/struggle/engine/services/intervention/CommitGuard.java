package tw.gc.struggle.engine.services.intervention;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot race between a decision task committing its intervention and the caller abandoning
 * the task when its time budget runs out. Exactly one side wins.
 */
public final class CommitGuard {

    private enum State { OPEN, COMMITTED, ABANDONED }

    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);

    /**
     * @return true if the task may deliver; false once the caller has abandoned it
     */
    public boolean commit() {
        return state.compareAndSet(State.OPEN, State.COMMITTED);
    }

    /**
     * @return true if the task was abandoned; false if it had already committed
     */
    public boolean abandon() {
        return state.compareAndSet(State.OPEN, State.ABANDONED);
    }

    public boolean isAbandoned() {
        return state.get() == State.ABANDONED;
    }
}
