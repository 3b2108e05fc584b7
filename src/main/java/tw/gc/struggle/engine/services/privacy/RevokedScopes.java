package tw.gc.struggle.engine.services.privacy;

import tw.gc.struggle.engine.enums.ConsentScope;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Consent scopes revoked in one withdrawal and the learner data each of them governs.
 *
 * <ul>
 *   <li>{@code behavioralTiming}: raw signals, session summaries, struggle events and the alerts
 *   built from them, plus any live session</li>
 *   <li>{@code chatInteractions}: learner identity on intervention records and the in-memory
 *   delivery ledger</li>
 *   <li>{@code anonymizedAnalytics}: learner identity on instructor alerts</li>
 * </ul>
 * Scopes the engine never reads purge nothing. {@code all} covers every category and also
 * removes the consent record.
 */
public record RevokedScopes(Set<ConsentScope> scopes) {

    public RevokedScopes {
        scopes = scopes.isEmpty() ? EnumSet.noneOf(ConsentScope.class) : EnumSet.copyOf(scopes);
    }

    public static RevokedScopes of(ConsentScope... scopes) {
        return new RevokedScopes(Set.of(scopes));
    }

    public static RevokedScopes full() {
        return of(ConsentScope.ALL);
    }

    /**
     * Null or blank means a full withdrawal.
     */
    public static RevokedScopes decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            return full();
        }
        Set<ConsentScope> scopes = Arrays.stream(encoded.split(","))
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .map(ConsentScope::fromCode)
                .collect(Collectors.toCollection(() -> EnumSet.noneOf(ConsentScope.class)));
        return new RevokedScopes(scopes);
    }

    public String encode() {
        return scopes.stream().map(ConsentScope::getCode).collect(Collectors.joining(","));
    }

    public RevokedScopes plus(RevokedScopes other) {
        Set<ConsentScope> merged = EnumSet.noneOf(ConsentScope.class);
        merged.addAll(scopes);
        merged.addAll(other.scopes);
        return new RevokedScopes(merged);
    }

    public boolean isFull() {
        return scopes.contains(ConsentScope.ALL);
    }

    public boolean coversBehavioralData() {
        return isFull() || scopes.contains(ConsentScope.BEHAVIORAL_TIMING);
    }

    public boolean coversInterventions() {
        return isFull() || scopes.contains(ConsentScope.CHAT_INTERACTIONS);
    }

    public boolean coversAlerts() {
        return coversBehavioralData() || scopes.contains(ConsentScope.ANONYMIZED_ANALYTICS);
    }

    public boolean purgesAnything() {
        return coversBehavioralData() || coversInterventions() || coversAlerts();
    }
}
