package tw.gc.struggle.engine.services.scoring;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.enums.StruggleFactor;
import tw.gc.struggle.engine.exceptions.ModelException;
import tw.gc.struggle.engine.services.session.SessionFeatures;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static tw.gc.struggle.engine.testutil.SignalFixtures.features;

class StruggleScorerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private StruggleScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new StruggleScorer(new EngineProperties());
    }

    @Nested
    @DisplayName("Risk computation")
    class RiskComputation {

        @Test
        @DisplayName("Frequent idling with many wrong answers scores as high risk")
        void idleAndErrors_highRisk() {
            StruggleAssessment result = scorer.score("s-1", "u-1", features(0.8, 0.5), PageContext.NONE, NOW);

            // (0.35 * 0.8 + 0.35 * 1.0) * 1.1
            assertThat(result.riskLevel()).isCloseTo(0.693, within(1e-9));
            assertThat(result.riskLevel()).isGreaterThanOrEqualTo(0.6);
            assertThat(result.contributingFactors())
                    .containsExactly(StruggleFactor.ERROR_RATE, StruggleFactor.IDLE_FREQUENCY);
            assertThat(result.factorCodes()).isEqualTo("error_rate,idle_frequency");
        }

        @Test
        @DisplayName("Calm session scores zero with no contributing factors")
        void calmSession_zeroRisk() {
            StruggleAssessment result = scorer.score("s-1", "u-1", features(0, 0), PageContext.NONE, NOW);

            assertThat(result.riskLevel()).isZero();
            assertThat(result.contributingFactors()).isEmpty();
        }

        @Test
        @DisplayName("Single crossed factor gets no compound boost")
        void singleFactor_noBoost() {
            StruggleAssessment result = scorer.score("s-1", "u-1", features(0.8, 0), PageContext.NONE, NOW);

            assertThat(result.riskLevel()).isCloseTo(0.28, within(1e-9));
            assertThat(result.contributingFactors()).containsExactly(StruggleFactor.IDLE_FREQUENCY);
        }

        @Test
        @DisplayName("Intensity under the noise floor contributes nothing")
        void belowNoiseFloor_ignored() {
            SessionFeatures noisy = new SessionFeatures(10, 20, 3_000, 0, 0, 0.02, 0.04,
                    0, 0, 0, 0, 1, 0, 0, 1, 1);

            StruggleAssessment result = scorer.score("s-1", "u-1", noisy, PageContext.NONE, NOW);

            assertThat(result.riskLevel()).isZero();
            assertThat(result.contributionOf(StruggleFactor.HELP_REQUEST_RATE)).isZero();
        }

        @Test
        @DisplayName("Risk is clamped to one")
        void saturatedFeatures_clamped() {
            SessionFeatures extreme = new SessionFeatures(10, 20, 3_000, 0, 5, 1, 1,
                    5, 1, 0, 60_000, 0, 1, 1, 0, 1);

            StruggleAssessment result = scorer.score("s-1", "u-1", extreme, PageContext.NONE, NOW);

            assertThat(result.riskLevel()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Difficult content raises the hover threshold")
        void difficultContent_hoverDiscounted() {
            SessionFeatures hovering = new SessionFeatures(10, 20, 3_000, 0, 0, 0, 0,
                    0, 0, 0, 6_000, 1, 0, 0, 1, 1);

            StruggleAssessment easy = scorer.score("s-1", "u-1", hovering, PageContext.NONE, NOW);
            StruggleAssessment hard = scorer.score("s-1", "u-1", hovering, new PageContext("hash", 1.0), NOW);

            assertThat(easy.contributingFactors()).containsExactly(StruggleFactor.HOVER_DURATION);
            assertThat(hard.contributingFactors()).isEmpty();
            assertThat(hard.riskLevel()).isLessThan(easy.riskLevel());
        }
    }

    @Nested
    @DisplayName("Confidence and timing")
    class ConfidenceAndTiming {

        @Test
        @DisplayName("Full samples and stable history give full confidence and a timing estimate")
        void fullConfidence_timeToStruggle() {
            StruggleAssessment result = scorer.score("s-1", "u-1", features(0.8, 0.5), PageContext.NONE, NOW);

            assertThat(result.confidence()).isEqualTo(1.0);
            // 30 * (1 - 0.693) = 9.21
            assertThat(result.estimatedTimeToStruggleMinutes()).isEqualTo(9.2);
        }

        @Test
        @DisplayName("Low confidence leaves time-to-struggle absent")
        void lowConfidence_noTiming() {
            StruggleAssessment result = scorer.score("s-1", "u-1", features(0.8, 0.5, 2, 0.5), PageContext.NONE, NOW);

            assertThat(result.confidence()).isLessThan(0.4);
            assertThat(result.estimatedTimeToStruggleMinutes()).isNull();
            assertThat(result.riskLevel()).isGreaterThan(0.6);
        }

        @Test
        @DisplayName("Time-to-struggle never drops below the minimum")
        void timing_floored() {
            SessionFeatures extreme = new SessionFeatures(10, 20, 3_000, 0, 5, 1, 1,
                    5, 1, 0, 60_000, 0, 1, 1, 0, 1);

            StruggleAssessment result = scorer.score("s-1", "u-1", extreme, PageContext.NONE, NOW);

            assertThat(result.estimatedTimeToStruggleMinutes()).isEqualTo(5.0);
        }

        @Test
        @DisplayName("Assessment is valid for the prediction horizon")
        void validUntil_horizon() {
            StruggleAssessment result = scorer.score("s-1", "u-1", features(0.2, 0.1), PageContext.NONE, NOW);

            assertThat(result.validUntil()).isEqualTo(NOW.plus(30, ChronoUnit.MINUTES));
            assertThat(result.modelVersion()).isEqualTo("linear-v1");
        }
    }

    @Nested
    @DisplayName("Determinism and validation")
    class DeterminismAndValidation {

        @Test
        @DisplayName("Identical inputs give identical assessments")
        void deterministic() {
            SessionFeatures input = features(0.6, 0.3, 7, 0.8);

            StruggleAssessment first = scorer.score("s-1", "u-1", input, PageContext.NONE, NOW);
            StruggleAssessment second = scorer.score("s-1", "u-1", input, PageContext.NONE, NOW);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Non-finite feature values are a model error")
        void nonFinite_throws() {
            SessionFeatures broken = new SessionFeatures(10, 20, 3_000, 0, Double.NaN, 0, 0,
                    0, 0, 0, 0, 1, 0, 0, 1, 1);

            assertThatThrownBy(() -> scorer.score("s-1", "u-1", broken, PageContext.NONE, NOW))
                    .isInstanceOf(ModelException.class);
        }

        @Test
        @DisplayName("Missing features are a model error")
        void nullFeatures_throws() {
            assertThatThrownBy(() -> scorer.score("s-1", "u-1", null, PageContext.NONE, NOW))
                    .isInstanceOf(ModelException.class);
        }
    }
}
