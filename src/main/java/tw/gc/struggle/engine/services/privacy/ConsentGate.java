package tw.gc.struggle.engine.services.privacy;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.entities.PrivacyConsent;
import tw.gc.struggle.engine.enums.CollectionLevel;
import tw.gc.struggle.engine.enums.ConsentDenialReason;
import tw.gc.struggle.engine.enums.ConsentScope;
import tw.gc.struggle.engine.repositories.PrivacyConsentRepository;
import tw.gc.struggle.engine.services.ops.EngineStatusService;
import tw.gc.struggle.engine.services.ops.OperatorAlertService;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Authoritative consent check for every signal and every intervention.
 *
 * <p>Backed by a process-wide cache with an explicit lifecycle: warmed at startup, entries
 * refreshed after a TTL or invalidated by the consent webhook, cleared at shutdown. A store
 * failure always denies.</p>
 */
@Service
@Slf4j
public class ConsentGate {

    private final PrivacyConsentRepository consentRepository;
    private final PurgeTaskQueue purgeTaskQueue;
    private final OperatorAlertService operatorAlertService;
    private final EngineStatusService statusService;
    private final EngineProperties properties;
    private final Clock clock;
    private final ExecutorService persistenceExecutor;

    private final Map<String, CachedConsent> cache = new ConcurrentHashMap<>();
    private final Set<String> purgeRequested = ConcurrentHashMap.newKeySet();

    public ConsentGate(PrivacyConsentRepository consentRepository,
                       PurgeTaskQueue purgeTaskQueue,
                       OperatorAlertService operatorAlertService,
                       EngineStatusService statusService,
                       EngineProperties properties,
                       Clock clock,
                       @Qualifier("persistenceExecutor") ExecutorService persistenceExecutor) {
        this.consentRepository = consentRepository;
        this.purgeTaskQueue = purgeTaskQueue;
        this.operatorAlertService = operatorAlertService;
        this.statusService = statusService;
        this.properties = properties;
        this.clock = clock;
        this.persistenceExecutor = persistenceExecutor;
    }

    private record CachedConsent(ConsentSnapshot snapshot, Instant loadedAt) {
    }

    @PostConstruct
    public void warmUp() {
        int limit = properties.getConsent().getWarmUpLimit();
        if (limit <= 0) {
            return;
        }
        try {
            Instant now = clock.instant();
            consentRepository.findAll(PageRequest.of(0, limit)).forEach(consent ->
                    cache.put(key(consent.getTenantId(), consent.getUserId()),
                            new CachedConsent(ConsentSnapshot.of(consent), now)));
            log.info("✅ Consent cache warmed with {} records", cache.size());
        } catch (DataAccessException e) {
            log.warn("⚠️ Consent cache warm-up failed, entries will load on demand: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        cache.clear();
        purgeRequested.clear();
    }

    public ConsentDecision check(String tenantId, String userId, ConsentScope scope) {
        Optional<ConsentSnapshot> snapshot;
        try {
            snapshot = lookup(tenantId, userId);
        } catch (DataAccessException e) {
            statusService.recordConsentStoreFailure();
            log.error("❌ Consent store unreachable, denying {} for tenant {}: {}", scope, tenantId, e.getMessage());
            operatorAlertService.escalate("consent-store", "Consent store unreachable: " + e.getMessage());
            return ConsentDecision.denied(ConsentDenialReason.STORE_UNAVAILABLE);
        }

        if (snapshot.isEmpty()) {
            return ConsentDecision.denied(ConsentDenialReason.NO_RECORD);
        }
        ConsentSnapshot consent = snapshot.get();
        if (consent.isWithdrawn()) {
            requestPurge(tenantId, userId);
            return ConsentDecision.denied(ConsentDenialReason.WITHDRAWN);
        }
        if (!consent.isGranted(scope)) {
            return ConsentDecision.denied(ConsentDenialReason.SCOPE_NOT_GRANTED);
        }
        return ConsentDecision.allowed(consent.collectionLevel());
    }

    public boolean isAllowed(String tenantId, String userId, ConsentScope scope) {
        return check(tenantId, userId, scope).allowed();
    }

    /**
     * Drop the cached entry so the next check reads the store.
     */
    public void invalidate(String tenantId, String userId) {
        String key = key(tenantId, userId);
        cache.remove(key);
        purgeRequested.remove(key);
        log.debug("Consent cache invalidated for tenant {}", tenantId);
    }

    public int cachedEntries() {
        return cache.size();
    }

    private Optional<ConsentSnapshot> lookup(String tenantId, String userId) {
        String key = key(tenantId, userId);
        Instant now = clock.instant();
        Duration ttl = Duration.ofSeconds(properties.getConsent().getCacheTtlSeconds());

        CachedConsent cached = cache.get(key);
        if (cached != null && cached.loadedAt().plus(ttl).isAfter(now)) {
            return Optional.ofNullable(cached.snapshot());
        }

        Optional<PrivacyConsent> loaded = consentRepository.findByTenantIdAndUserId(tenantId, userId);
        ConsentSnapshot snapshot = loaded.map(ConsentSnapshot::of).orElse(null);
        cache.put(key, new CachedConsent(snapshot, now));
        return Optional.ofNullable(snapshot);
    }

    private void requestPurge(String tenantId, String userId) {
        if (!purgeRequested.add(key(tenantId, userId))) {
            return;
        }
        try {
            persistenceExecutor.execute(() -> {
                try {
                    purgeTaskQueue.enqueueWithdrawal(tenantId, userId);
                } catch (DataAccessException e) {
                    purgeRequested.remove(key(tenantId, userId));
                    log.error("❌ Failed to queue withdrawal purge for tenant {}: {}", tenantId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            purgeRequested.remove(key(tenantId, userId));
            log.warn("⚠️ Purge enqueue rejected, will retry on next denial: {}", e.getMessage());
        }
    }

    private static String key(String tenantId, String userId) {
        return tenantId + "|" + userId;
    }

    /**
     * Collection level for content minimisation; minimal when unknown.
     */
    public CollectionLevel collectionLevel(String tenantId, String userId) {
        ConsentDecision decision = check(tenantId, userId, ConsentScope.BEHAVIORAL_TIMING);
        return decision.allowed() ? decision.collectionLevel() : CollectionLevel.MINIMAL;
    }
}
