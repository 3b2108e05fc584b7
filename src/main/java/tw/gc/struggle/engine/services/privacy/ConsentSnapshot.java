package tw.gc.struggle.engine.services.privacy;

import tw.gc.struggle.engine.entities.PrivacyConsent;
import tw.gc.struggle.engine.enums.CollectionLevel;
import tw.gc.struggle.engine.enums.ConsentScope;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable cached view of a {@link PrivacyConsent} row.
 */
record ConsentSnapshot(Set<ConsentScope> grantedScopes, CollectionLevel collectionLevel, LocalDateTime withdrawnAt) {

    static ConsentSnapshot of(PrivacyConsent consent) {
        Set<ConsentScope> granted = EnumSet.noneOf(ConsentScope.class);
        for (ConsentScope scope : ConsentScope.values()) {
            if (scope != ConsentScope.ALL && consent.isGranted(scope)) {
                granted.add(scope);
            }
        }
        return new ConsentSnapshot(Set.copyOf(granted), consent.getCollectionLevel(), consent.getWithdrawnAt());
    }

    boolean isGranted(ConsentScope scope) {
        if (scope == ConsentScope.ALL) {
            return grantedScopes.size() == ConsentScope.values().length - 1;
        }
        return grantedScopes.contains(scope);
    }

    boolean isWithdrawn() {
        return withdrawnAt != null;
    }
}
