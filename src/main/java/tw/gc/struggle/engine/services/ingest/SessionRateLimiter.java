package tw.gc.struggle.engine.services.ingest;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tw.gc.struggle.engine.config.EngineProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding one-minute window of accepted signals per session.
 */
@Component
public class SessionRateLimiter {

    private static final long WINDOW_SECONDS = 60;

    private final int limitPerMinute;
    private final Clock clock;
    private final Map<String, Deque<Instant>> windows = new ConcurrentHashMap<>();

    public SessionRateLimiter(EngineProperties properties, Clock clock) {
        this.limitPerMinute = properties.getIngest().getRateLimitPerMinute();
        this.clock = clock;
    }

    public boolean tryAcquire(String sessionId) {
        Instant now = clock.instant();
        Instant cutoff = now.minusSeconds(WINDOW_SECONDS);
        Deque<Instant> window = windows.computeIfAbsent(sessionId, id -> new ArrayDeque<>());
        synchronized (window) {
            while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
                window.pollFirst();
            }
            if (window.size() >= limitPerMinute) {
                return false;
            }
            window.addLast(now);
            return true;
        }
    }

    public void forget(String sessionId) {
        windows.remove(sessionId);
    }

    @Scheduled(fixedDelayString = "${engine.session.expiry-sweep-ms:60000}")
    public void evictIdle() {
        Instant cutoff = clock.instant().minusSeconds(WINDOW_SECONDS);
        windows.entrySet().removeIf(entry -> {
            Deque<Instant> window = entry.getValue();
            synchronized (window) {
                return window.isEmpty() || !window.peekLast().isAfter(cutoff);
            }
        });
    }
}
