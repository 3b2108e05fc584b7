package tw.gc.struggle.engine.services.session;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Virtual actor for one session: a FIFO mailbox drained by at most one pool thread at a time.
 *
 * <p>The {@code scheduled} flag is the single-runner guard. A drain hands the thread back
 * after a bounded batch so a chatty session cannot starve the others.</p>
 */
@Slf4j
final class SessionActor {

    static final int DRAIN_BATCH = 32;

    private final SessionState state;
    private final Executor executor;
    private final Queue<Runnable> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean scheduled = new AtomicBoolean(false);

    private volatile boolean closed;
    private volatile Instant lastActivity;

    SessionActor(SessionState state, Executor executor, Instant createdAt) {
        this.state = state;
        this.executor = executor;
        this.lastActivity = createdAt;
    }

    SessionState state() {
        return state;
    }

    boolean owns(String tenantId, String userId) {
        return state.tenantId().equals(tenantId) && state.userId().equals(userId);
    }

    boolean isClosed() {
        return closed;
    }

    Instant lastActivity() {
        return lastActivity;
    }

    /**
     * @return false when the pool refused the work; the message is dropped
     */
    boolean enqueue(Runnable message, Instant now) {
        lastActivity = now;
        mailbox.add(message);
        return schedule(message);
    }

    boolean close(Runnable finalMessage, Instant now) {
        closed = true;
        return enqueue(finalMessage, now);
    }

    int pending() {
        return mailbox.size();
    }

    private boolean schedule(Runnable justAdded) {
        if (!scheduled.compareAndSet(false, true)) {
            return true;
        }
        try {
            executor.execute(this::drain);
            return true;
        } catch (RejectedExecutionException e) {
            scheduled.set(false);
            mailbox.remove(justAdded);
            log.warn("⚠️ Session {} mailbox not scheduled: {}", state.sessionId(), e.getMessage());
            return false;
        }
    }

    private void drain() {
        int processed = 0;
        Runnable message;
        while (processed < DRAIN_BATCH && (message = mailbox.poll()) != null) {
            try {
                message.run();
            } catch (RuntimeException e) {
                log.error("❌ Session {} handler failed, continuing: {}", state.sessionId(), e.getMessage(), e);
            }
            processed++;
        }

        if (!mailbox.isEmpty()) {
            // Yield the thread but keep ownership of the mailbox
            try {
                executor.execute(this::drain);
                return;
            } catch (RejectedExecutionException e) {
                log.warn("⚠️ Session {} could not reschedule, {} messages pending", state.sessionId(), mailbox.size());
            }
        }

        scheduled.set(false);
        if (!mailbox.isEmpty() && scheduled.compareAndSet(false, true)) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                scheduled.set(false);
            }
        }
    }
}
