package tw.gc.struggle.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunable engine parameters. Scoring weights and decision thresholds are heuristics,
 * so every one of them lives here rather than in code.
 */
@Data
@Component
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {

    private Session session = new Session();
    private Ingest ingest = new Ingest();
    private Scoring scoring = new Scoring();
    private Intervention intervention = new Intervention();
    private Alerts alerts = new Alerts();
    private Retention retention = new Retention();
    private Consent consent = new Consent();

    @Data
    public static class Session {
        private int windowMinutes = 10;
        private int maxWindowSignals = 50;
        private int minSamples = 3;
        private int minElapsedSeconds = 60;
        private int idleTimeoutMinutes = 30;
        /** An idle signal at least this long counts as an idle period. */
        private long idleSignalThresholdMs = 30_000;
        /** Wall-clock budget for scoring + decision of one signal. */
        private long processingBudgetMs = 100;
        private int workerThreads = 8;
        private int decisionThreads = 4;
        private long expirySweepMs = 60_000;
    }

    @Data
    public static class Ingest {
        private String hmacSecret = "change-me";
        private List<String> allowedOrigins = new ArrayList<>();
        private List<String> allowedOriginPatterns = new ArrayList<>(List.of("^https://[\\w.-]+\\.instructure\\.com$"));
        private long maxNonceAgeSeconds = 300;
        private long maxClockSkewSeconds = 60;
        private int rateLimitPerMinute = 120;
    }

    @Data
    public static class Scoring {
        private String modelVersion = "linear-v1";
        private Weights weights = new Weights();
        private Saturation saturation = new Saturation();
        private Thresholds thresholds = new Thresholds();
        /** Normalized intensities below this are treated as noise. */
        private double noiseFloor = 0.10;
        /** Multiplier applied when two or more factors cross their thresholds together. */
        private double compoundBoost = 1.10;
        private double confidenceFloor = 0.40;
        private int fullConfidenceSamples = 10;
        private int predictionHorizonMinutes = 30;
        private int minTimeToStruggleMinutes = 5;
    }

    @Data
    public static class Weights {
        private double idleFrequency = 0.35;
        private double errorRate = 0.35;
        private double helpRequestRate = 0.10;
        private double responseTimeVariability = 0.10;
        private double hoverDuration = 0.10;
    }

    /**
     * Raw value at which a factor's normalized intensity reaches 1.0.
     */
    @Data
    public static class Saturation {
        private double idleFrequency = 1.0;
        private double errorRate = 0.5;
        private double helpRequestRate = 0.3;
        private double responseTimeVariability = 1.0;
        private double hoverDurationMs = 10_000;
    }

    /**
     * Raw value at which a factor is reported as contributing.
     */
    @Data
    public static class Thresholds {
        private double idleFrequency = 0.4;
        private double errorRate = 0.25;
        private double helpRequestRate = 0.15;
        private double responseTimeVariability = 0.5;
        private double hoverDurationMs = 5_000;
    }

    @Data
    public static class Intervention {
        private double riskThreshold = 0.50;
        private double confidenceThreshold = 0.50;
        private double highUrgencyRisk = 0.60;
        private double mediumUrgencyRisk = 0.50;
        private int dailyCap = 8;
        private int cooldownMinutes = 30;
        private int responseTimeoutMinutes = 10;
        private int effectivenessWindowMinutes = 15;
        private double fatigueBreakThreshold = 0.7;
        private boolean deliveryEnabled = false;
        private String chatUrl = "http://localhost:8090/api/proactive";
        private long timeoutSweepMs = 60_000;
    }

    @Data
    public static class Alerts {
        private int windowHours = 24;
        private double struggleRiskThreshold = 0.80;
        private double criticalRiskThreshold = 0.90;
        private double minConfidence = 0.60;
        private double repeatedRiskThreshold = 0.60;
        private int repeatedCount = 3;
        private int repeatedHighCount = 6;
        private int disengagementCount = 3;
        private double overloadCognitiveLoad = 0.75;
        private double overloadFatigue = 0.70;
        private int minCohortSize = 5;
        private int maxAlertsPerCourse = 10;
        private int queryTimeoutSeconds = 30;
        private int actionDeadlineHours = 24;
        private long fixedDelayMs = 900_000;
    }

    @Data
    public static class Retention {
        private int defaultRetentionDays = 90;
        private int purgeSlaHours = 24;
        private int maxAttempts = 5;
        private long backoffBaseSeconds = 60;
        private String anonymizationSalt = "struggle-engine";
        private long sweepFixedDelayMs = 60_000;
        private String retentionCron = "0 0 * * * *";
    }

    @Data
    public static class Consent {
        private long cacheTtlSeconds = 300;
        private int warmUpLimit = 10_000;
    }
}
