package tw.gc.struggle.engine.services.scoring;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.enums.StruggleFactor;
import tw.gc.struggle.engine.exceptions.ModelException;
import tw.gc.struggle.engine.services.session.SessionFeatures;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Struggle Scorer
 *
 * Explainable linear model over five named factors:
 * - Idle frequency: 35%
 * - Error rate: 35%
 * - Help-request rate: 10%
 * - Response-time variability: 10%
 * - Hover duration: 10%
 *
 * Each raw value is normalised by its saturation point; intensities under the noise floor
 * count as zero. When two or more factors cross their reporting thresholds together the
 * sum is boosted. Everything is clamped to [0,1].
 *
 * Pure: identical features, page context, model version and computedAt give an identical
 * assessment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StruggleScorer {

    private final EngineProperties properties;

    public StruggleAssessment score(String sessionId, String userId, SessionFeatures features,
                                    PageContext pageContext, Instant computedAt) {
        validate(features);
        EngineProperties.Scoring config = properties.getScoring();
        PageContext context = pageContext == null ? PageContext.NONE : pageContext;

        // Harder content earns more hover time before it reads as struggle
        double hoverScale = 1 + context.difficultyOrZero();

        List<FactorContribution> breakdown = List.of(
                factor(StruggleFactor.IDLE_FREQUENCY, features.idleFrequency(),
                        config.getSaturation().getIdleFrequency(), config.getThresholds().getIdleFrequency(),
                        config.getWeights().getIdleFrequency()),
                factor(StruggleFactor.ERROR_RATE, features.errorRate(),
                        config.getSaturation().getErrorRate(), config.getThresholds().getErrorRate(),
                        config.getWeights().getErrorRate()),
                factor(StruggleFactor.HELP_REQUEST_RATE, features.helpRequestRate(),
                        config.getSaturation().getHelpRequestRate(), config.getThresholds().getHelpRequestRate(),
                        config.getWeights().getHelpRequestRate()),
                factor(StruggleFactor.RESPONSE_TIME_VARIABILITY, features.responseTimeVariability(),
                        config.getSaturation().getResponseTimeVariability(),
                        config.getThresholds().getResponseTimeVariability(),
                        config.getWeights().getResponseTimeVariability()),
                factor(StruggleFactor.HOVER_DURATION, features.avgHoverMs(),
                        config.getSaturation().getHoverDurationMs() * hoverScale,
                        config.getThresholds().getHoverDurationMs() * hoverScale,
                        config.getWeights().getHoverDuration()));

        double risk = 0;
        int crossed = 0;
        for (FactorContribution contribution : breakdown) {
            risk += contribution.contribution();
            if (contribution.crossedThreshold()) {
                crossed++;
            }
        }
        if (crossed >= 2) {
            risk *= config.getCompoundBoost();
        }
        risk = round(clamp(risk), 4);

        List<StruggleFactor> contributing = breakdown.stream()
                .filter(FactorContribution::crossedThreshold)
                .sorted(Comparator.comparingDouble(FactorContribution::contribution).reversed()
                        .thenComparing(c -> c.factor().ordinal()))
                .map(FactorContribution::factor)
                .toList();

        double sampleShare = Math.min(1.0, (double) features.sampleCount() / config.getFullConfidenceSamples());
        double confidence = round(clamp(0.7 * sampleShare + 0.3 * features.stability()), 4);

        Double timeToStruggle = null;
        if (confidence >= config.getConfidenceFloor()) {
            double minutes = Math.max(config.getMinTimeToStruggleMinutes(),
                    config.getPredictionHorizonMinutes() * (1 - risk));
            timeToStruggle = round(minutes, 1);
        }

        Instant validUntil = computedAt.plus(Duration.ofMinutes(config.getPredictionHorizonMinutes()));

        log.debug("📊 Session {} risk={} confidence={} factors={}", sessionId, risk, confidence, contributing);

        return new StruggleAssessment(null, sessionId, userId, risk, confidence, timeToStruggle,
                contributing, breakdown, config.getModelVersion(), computedAt, validUntil);
    }

    private FactorContribution factor(StruggleFactor factor, double raw, double saturation, double threshold,
                                      double weight) {
        double intensity = saturation <= 0 ? 0 : clamp(raw / saturation);
        if (intensity < properties.getScoring().getNoiseFloor()) {
            intensity = 0;
        }
        boolean crossed = intensity > 0 && raw >= threshold;
        return new FactorContribution(factor, raw, intensity, weight * intensity, crossed);
    }

    private static void validate(SessionFeatures features) {
        if (features == null) {
            throw new ModelException("features are required");
        }
        double[] values = {
                features.idleFrequency(), features.errorRate(), features.helpRequestRate(),
                features.responseTimeVariability(), features.avgHoverMs(), features.stability()
        };
        for (double value : values) {
            if (!Double.isFinite(value) || value < 0) {
                throw new ModelException("malformed feature value: " + value);
            }
        }
        if (features.sampleCount() < 0) {
            throw new ModelException("negative sample count");
        }
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
