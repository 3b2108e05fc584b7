package tw.gc.struggle.engine.services.privacy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.entities.PrivacyConsent;
import tw.gc.struggle.engine.enums.CollectionLevel;
import tw.gc.struggle.engine.enums.ConsentScope;
import tw.gc.struggle.engine.repositories.PrivacyConsentRepository;
import tw.gc.struggle.engine.services.intervention.InterventionDecisionEngine;
import tw.gc.struggle.engine.services.session.SessionActorRegistry;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Write side of consent: the consent-UI webhook and full-record upserts.
 *
 * <p>Every change invalidates the gate's cached entry. A revoked scope then queues a durable
 * purge of the data it governs; revoking behavioral timing also stops the learner's live
 * sessions, and revoking chat interactions forgets their intervention history.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsentService {

    private static final Set<ConsentScope> RECORD_SCOPES = EnumSet.complementOf(EnumSet.of(ConsentScope.ALL));

    private final PrivacyConsentRepository consentRepository;
    private final ConsentGate consentGate;
    private final PurgeTaskQueue purgeTaskQueue;
    private final SessionActorRegistry sessionRegistry;
    private final InterventionDecisionEngine decisionEngine;
    private final Clock clock;

    /**
     * Apply a single consent change event. Scope {@code all} with {@code granted=false} is a
     * full withdrawal.
     */
    public PrivacyConsent handleWebhook(String tenantId, String userId, ConsentScope scope, boolean granted) {
        LocalDateTime now = LocalDateTime.now(clock);
        PrivacyConsent consent = consentRepository.findByTenantIdAndUserId(tenantId, userId)
                .orElseGet(() -> PrivacyConsent.builder()
                        .tenantId(tenantId)
                        .userId(userId)
                        .collectionLevel(CollectionLevel.STANDARD)
                        .build());

        boolean wasGranted = consent.isGranted(scope);
        consent.setGranted(scope, granted);
        if (granted) {
            consent.setWithdrawnAt(null);
        } else if (scope == ConsentScope.ALL) {
            consent.setWithdrawnAt(now);
        }
        consent.setUpdatedAt(now);
        PrivacyConsent saved = consentRepository.save(consent);
        consentGate.invalidate(tenantId, userId);

        log.info("🔐 Consent {} {} for tenant {}", scope.getCode(), granted ? "granted" : "withdrawn", tenantId);
        if (!granted && (wasGranted || scope == ConsentScope.ALL)) {
            onWithdrawal(tenantId, userId, RevokedScopes.of(scope));
        }
        return saved;
    }

    /**
     * Replace the stored record with {@code incoming}; its withdrawal timestamp is only read as a
     * flag and restamped here. Any scope going from granted to
     * revoked, or a new withdrawal timestamp, runs the withdrawal flow.
     */
    public PrivacyConsent upsert(PrivacyConsent incoming) {
        LocalDateTime now = LocalDateTime.now(clock);
        String tenantId = incoming.getTenantId();
        String userId = incoming.getUserId();

        PrivacyConsent existing = consentRepository.findByTenantIdAndUserId(tenantId, userId).orElse(null);
        RevokedScopes revoked = revokedScopes(existing, incoming);

        PrivacyConsent target = existing != null ? existing : PrivacyConsent.builder()
                .tenantId(tenantId)
                .userId(userId)
                .build();
        for (ConsentScope scope : RECORD_SCOPES) {
            target.setGranted(scope, incoming.isGranted(scope));
        }
        target.setCollectionLevel(incoming.getCollectionLevel() != null
                ? incoming.getCollectionLevel() : CollectionLevel.STANDARD);
        if (incoming.isWithdrawn()) {
            target.setWithdrawnAt(existing != null && existing.isWithdrawn() ? existing.getWithdrawnAt() : now);
        } else {
            target.setWithdrawnAt(null);
        }
        target.setUpdatedAt(now);

        PrivacyConsent saved = consentRepository.save(target);
        consentGate.invalidate(tenantId, userId);
        log.info("🔐 Consent record {} for tenant {}", existing == null ? "created" : "updated", tenantId);

        if (!revoked.scopes().isEmpty()) {
            onWithdrawal(tenantId, userId, revoked);
        }
        return saved;
    }

    static boolean isWithdrawal(PrivacyConsent existing, PrivacyConsent incoming) {
        return !revokedScopes(existing, incoming).scopes().isEmpty();
    }

    /**
     * Scopes {@code incoming} takes away from {@code existing}; a new withdrawal timestamp
     * revokes everything.
     */
    static RevokedScopes revokedScopes(PrivacyConsent existing, PrivacyConsent incoming) {
        if (incoming.isWithdrawn()) {
            return existing == null || !existing.isWithdrawn() ? RevokedScopes.full() : RevokedScopes.of();
        }
        if (existing == null) {
            return RevokedScopes.of();
        }
        Set<ConsentScope> revoked = EnumSet.noneOf(ConsentScope.class);
        for (ConsentScope scope : RECORD_SCOPES) {
            if (existing.isGranted(scope) && !incoming.isGranted(scope)) {
                revoked.add(scope);
            }
        }
        return new RevokedScopes(revoked);
    }

    private void onWithdrawal(String tenantId, String userId, RevokedScopes revoked) {
        int discarded = 0;
        if (revoked.coversBehavioralData()) {
            discarded = sessionRegistry.discardUser(tenantId, userId);
        }
        if (revoked.coversInterventions()) {
            decisionEngine.forgetUser(tenantId, userId);
        }
        boolean queued = purgeTaskQueue.enqueueWithdrawal(tenantId, userId, revoked).isPresent();
        log.info("🧹 Withdrawal [{}] handled for tenant {}: {} live sessions discarded, purge {}",
                revoked.encode(), tenantId, discarded, queued ? "queued" : "not needed or already queued");
    }
}
