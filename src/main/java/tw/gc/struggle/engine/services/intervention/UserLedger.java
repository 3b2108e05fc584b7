package tw.gc.struggle.engine.services.intervention;

import tw.gc.struggle.engine.enums.InterventionType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-user delivery history: trigger times in the rolling day and the last trigger per type.
 * Not thread-safe; callers hold the ledger's monitor.
 */
final class UserLedger {

    private final Deque<Instant> triggeredInWindow = new ArrayDeque<>();
    private final Map<InterventionType, Instant> lastByType = new EnumMap<>(InterventionType.class);
    private Instant lastTouched;

    UserLedger(Instant createdAt) {
        this.lastTouched = createdAt;
    }

    void prune(Instant windowStart) {
        while (!triggeredInWindow.isEmpty() && !triggeredInWindow.peekFirst().isAfter(windowStart)) {
            triggeredInWindow.pollFirst();
        }
    }

    int countInWindow() {
        return triggeredInWindow.size();
    }

    boolean inCooldown(InterventionType type, Instant now, Duration cooldown) {
        Instant last = lastByType.get(type);
        return last != null && now.isBefore(last.plus(cooldown));
    }

    void record(InterventionType type, Instant at) {
        triggeredInWindow.addLast(at);
        lastByType.merge(type, at, (existing, candidate) -> candidate.isAfter(existing) ? candidate : existing);
        lastTouched = at;
    }

    void touch(Instant at) {
        lastTouched = at;
    }

    Instant lastTouched() {
        return lastTouched;
    }
}
