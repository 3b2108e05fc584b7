package tw.gc.struggle.engine.services.session;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.services.ingest.BehavioralSignal;
import tw.gc.struggle.engine.services.ops.EngineStatusService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Addresses session actors by session id.
 *
 * <p>Actors are created lazily on the first signal and removed on explicit close, idle
 * expiry or consent withdrawal. Creation, enqueue and removal for one key all go through
 * the map's per-key atomic operations, so a close can never overtake a signal that was
 * accepted before it.</p>
 */
@Service
@Slf4j
public class SessionActorRegistry {

    public enum SubmitOutcome {
        ACCEPTED, OWNER_MISMATCH, UNAVAILABLE
    }

    private final SessionProcessor processor;
    private final EngineStatusService statusService;
    private final EngineProperties properties;
    private final Clock clock;
    private final ExecutorService sessionActorExecutor;

    private final Map<String, SessionActor> actors = new ConcurrentHashMap<>();
    private volatile boolean shuttingDown;

    public SessionActorRegistry(SessionProcessor processor,
                                EngineStatusService statusService,
                                EngineProperties properties,
                                Clock clock,
                                @Qualifier("sessionActorExecutor") ExecutorService sessionActorExecutor) {
        this.processor = processor;
        this.statusService = statusService;
        this.properties = properties;
        this.clock = clock;
        this.sessionActorExecutor = sessionActorExecutor;
    }

    public SubmitOutcome submit(BehavioralSignal signal) {
        if (shuttingDown) {
            return SubmitOutcome.UNAVAILABLE;
        }
        Instant now = clock.instant();
        SubmitOutcome[] outcome = {SubmitOutcome.ACCEPTED};

        actors.compute(signal.sessionId(), (sessionId, existing) -> {
            if (existing != null && !existing.owns(signal.tenantId(), signal.userId())) {
                outcome[0] = SubmitOutcome.OWNER_MISMATCH;
                return existing;
            }
            SessionActor actor = existing;
            if (actor == null) {
                actor = new SessionActor(SessionState.open(signal), sessionActorExecutor, now);
                statusService.recordSessionOpened();
                log.info("🆕 Session {} opened", sessionId);
            }
            SessionState state = actor.state();
            if (!actor.enqueue(() -> processor.onSignal(state, signal), now)) {
                outcome[0] = SubmitOutcome.UNAVAILABLE;
                return existing;
            }
            return actor;
        });

        if (outcome[0] == SubmitOutcome.OWNER_MISMATCH) {
            log.warn("⚠️ Session {} signal from a different learner refused", signal.sessionId());
        }
        return outcome[0];
    }

    /**
     * Close after all previously accepted signals of the session have been processed.
     *
     * @return false if no such session is active
     */
    public boolean close(String sessionId) {
        SessionActor actor = actors.remove(sessionId);
        if (actor == null) {
            return false;
        }
        stop(actor, CloseReason.CLOSED);
        return true;
    }

    /**
     * Stop every session of a learner without flushing anything.
     */
    public int discardUser(String tenantId, String userId) {
        int discarded = 0;
        for (Map.Entry<String, SessionActor> entry : actors.entrySet()) {
            SessionActor actor = entry.getValue();
            if (actor.owns(tenantId, userId) && actors.remove(entry.getKey(), actor)) {
                stop(actor, CloseReason.DISCARDED);
                discarded++;
            }
        }
        if (discarded > 0) {
            log.info("🗑️ Discarded {} active sessions of a withdrawn learner in tenant {}", discarded, tenantId);
        }
        return discarded;
    }

    @Scheduled(fixedDelayString = "${engine.session.expiry-sweep-ms:60000}")
    public int expireIdle() {
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(properties.getSession().getIdleTimeoutMinutes()));
        int expired = 0;
        for (Map.Entry<String, SessionActor> entry : actors.entrySet()) {
            SessionActor actor = entry.getValue();
            if (actor.lastActivity().isBefore(cutoff) && actors.remove(entry.getKey(), actor)) {
                stop(actor, CloseReason.EXPIRED);
                expired++;
            }
        }
        if (expired > 0) {
            log.info("⏳ Expired {} idle sessions", expired);
        }
        return expired;
    }

    public boolean isActive(String sessionId) {
        return actors.containsKey(sessionId);
    }

    public int activeSessions() {
        return actors.size();
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        int open = actors.size();
        actors.forEach((sessionId, actor) -> {
            if (actors.remove(sessionId, actor)) {
                stop(actor, CloseReason.SHUTDOWN);
            }
        });
        log.info("🛑 Session registry stopped, {} sessions flushed", open);
    }

    private void stop(SessionActor actor, CloseReason reason) {
        SessionState state = actor.state();
        if (!actor.close(() -> processor.onClose(state, reason), clock.instant())) {
            log.warn("⚠️ Session {} could not be closed cleanly ({})", state.sessionId(), reason.getCode());
        }
    }
}
