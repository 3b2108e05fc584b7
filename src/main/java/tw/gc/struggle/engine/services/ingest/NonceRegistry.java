package tw.gc.struggle.engine.services.ingest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import tw.gc.struggle.engine.config.EngineProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Replay protection: remembers every nonce of a session until its signal timestamp leaves
 * the freshness window.
 *
 * <p>A nonce is only dropped once the freshness check would reject its signal anyway, so
 * eviction never reopens a replay.</p>
 */
@Component
@Slf4j
public class NonceRegistry {

    private final long maxAgeSeconds;
    private final Clock clock;
    private final Map<String, SessionNonces> sessions = new ConcurrentHashMap<>();

    public NonceRegistry(EngineProperties properties, Clock clock) {
        this.maxAgeSeconds = properties.getIngest().getMaxNonceAgeSeconds();
        this.clock = clock;
    }

    private static final class SessionNonces {
        private final Map<String, Instant> nonces = new ConcurrentHashMap<>();
        private Instant lastSeen;
    }

    /**
     * @param signalTime timestamp the nonce was signed with
     * @return false if the nonce was already used for this session
     */
    public boolean register(String sessionId, String nonce, Instant signalTime) {
        Instant now = clock.instant();
        Instant cutoff = now.minusSeconds(maxAgeSeconds);
        boolean[] fresh = new boolean[1];
        sessions.compute(sessionId, (id, window) -> {
            SessionNonces current = window != null ? window : new SessionNonces();
            current.lastSeen = now;
            current.nonces.values().removeIf(stamp -> stamp.isBefore(cutoff));
            fresh[0] = current.nonces.putIfAbsent(nonce, signalTime) == null;
            return current;
        });
        return fresh[0];
    }

    public void forget(String sessionId) {
        sessions.remove(sessionId);
    }

    public int trackedSessions() {
        return sessions.size();
    }

    int trackedNonces(String sessionId) {
        SessionNonces window = sessions.get(sessionId);
        return window == null ? 0 : window.nonces.size();
    }

    /**
     * Drops sessions whose nonces have all left the freshness window.
     */
    @Scheduled(fixedDelayString = "${engine.session.expiry-sweep-ms:60000}")
    public void evictStale() {
        Instant cutoff = clock.instant().minusSeconds(maxAgeSeconds);
        int evicted = 0;
        for (String sessionId : sessions.keySet()) {
            boolean[] removed = new boolean[1];
            sessions.computeIfPresent(sessionId, (id, window) -> {
                removed[0] = window.lastSeen.isBefore(cutoff)
                        && window.nonces.values().stream().allMatch(stamp -> stamp.isBefore(cutoff));
                return removed[0] ? null : window;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted nonce windows of {} quiet sessions", evicted);
        }
    }
}
