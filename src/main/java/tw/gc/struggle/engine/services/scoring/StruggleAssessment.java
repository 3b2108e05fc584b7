package tw.gc.struggle.engine.services.scoring;

import tw.gc.struggle.engine.enums.StruggleFactor;

import java.time.Instant;
import java.util.List;

/**
 * Immutable scoring result. {@code estimatedTimeToStruggleMinutes} is null when the
 * confidence is too low to predict timing, which is distinct from low risk.
 */
public record StruggleAssessment(
        String assessmentId,
        String sessionId,
        String userId,
        double riskLevel,
        double confidence,
        Double estimatedTimeToStruggleMinutes,
        List<StruggleFactor> contributingFactors,
        List<FactorContribution> breakdown,
        String modelVersion,
        Instant computedAt,
        Instant validUntil
) {
    public StruggleAssessment {
        contributingFactors = List.copyOf(contributingFactors);
        breakdown = List.copyOf(breakdown);
    }

    public StruggleAssessment withAssessmentId(String id) {
        return new StruggleAssessment(id, sessionId, userId, riskLevel, confidence, estimatedTimeToStruggleMinutes,
                contributingFactors, breakdown, modelVersion, computedAt, validUntil);
    }

    public double contributionOf(StruggleFactor factor) {
        for (FactorContribution contribution : breakdown) {
            if (contribution.factor() == factor) {
                return contribution.contribution();
            }
        }
        return 0;
    }

    public String factorCodes() {
        return String.join(",", contributingFactors.stream().map(StruggleFactor::getCode).toList());
    }
}
