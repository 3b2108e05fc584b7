package tw.gc.struggle.engine.services.session;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tw.gc.struggle.engine.config.EngineProperties;
import tw.gc.struggle.engine.enums.SignalType;
import tw.gc.struggle.engine.exceptions.ModelException;
import tw.gc.struggle.engine.services.ingest.BehavioralSignal;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;

/**
 * Derives {@link SessionFeatures} from a session window. Stateless; the previous features
 * are passed in to measure stability.
 */
@Component
@RequiredArgsConstructor
public class SessionFeatureExtractor {

    /** Idle periods at which idle frequency saturates. */
    static final int IDLE_SATURATION_COUNT = 5;
    /** Session length contributing half of the fatigue estimate. */
    static final double FATIGUE_SESSION_MINUTES = 120.0;
    /** Session length after which duration starts adding cognitive load. */
    static final double LOAD_ONSET_MINUTES = 60.0;
    /** Hover duration used to scale hover drift in the stability measure. */
    static final double HOVER_SCALE_MS = 10_000.0;

    private final EngineProperties properties;

    public SessionFeatures extract(Collection<BehavioralSignal> window, Instant sessionStart, Instant now,
                                   SessionFeatures previous) {
        if (window.isEmpty()) {
            return SessionFeatures.EMPTY;
        }

        long idleThreshold = properties.getSession().getIdleSignalThresholdMs();
        int n = 0;
        int responses = 0;
        double responseSum = 0;
        double responseSquares = 0;
        int helpRequests = 0;
        int graded = 0;
        int errors = 0;
        int idleCount = 0;
        int taskSwitches = 0;
        int hovers = 0;
        double hoverSum = 0;
        int interactions = 0;

        for (BehavioralSignal signal : window) {
            if (signal == null || signal.type() == null) {
                throw new ModelException("window contains an incomplete signal");
            }
            n++;
            long duration = signal.durationMs();
            SignalType type = signal.type();
            if (type.isResponse()) {
                responses++;
                responseSum += duration;
                responseSquares += (double) duration * duration;
            }
            if (type.isTaskSwitch()) {
                taskSwitches++;
            }
            switch (type) {
                case HELP_REQUEST -> {
                    helpRequests++;
                    interactions++;
                }
                case QUIZ_INTERACTION -> {
                    interactions++;
                    if (signal.correct() != null) {
                        graded++;
                        if (signal.isError()) {
                            errors++;
                        }
                    }
                }
                case CLICK, SCROLL -> interactions++;
                case IDLE -> {
                    if (duration >= idleThreshold) {
                        idleCount++;
                    }
                }
                case HOVER -> {
                    hovers++;
                    hoverSum += duration;
                }
                default -> {
                }
            }
        }

        double avgResponse = responses == 0 ? 0 : responseSum / responses;
        double variance = responses == 0 ? 0 : Math.max(0, responseSquares / responses - avgResponse * avgResponse);
        double variability = responses < 2 || avgResponse <= 0 ? 0 : Math.sqrt(variance) / avgResponse;
        double helpRate = (double) helpRequests / n;
        double errorRate = graded == 0 ? 0 : (double) errors / graded;
        double idleFrequency = Math.min(1.0, (double) idleCount / IDLE_SATURATION_COUNT);
        double taskSwitch = (double) taskSwitches / n;
        double avgHover = hovers == 0 ? 0 : hoverSum / hovers;
        double sessionMinutes = Math.max(0, Duration.between(sessionStart, now).toMillis() / 60_000.0);

        double attention = clamp(1 - 0.5 * idleFrequency - 0.5 * taskSwitch);
        double fatigue = clamp(Math.min(1.0, sessionMinutes / FATIGUE_SESSION_MINUTES) * 0.5 + idleFrequency * 0.5);
        double durationLoad = Math.max(0, Math.min(1.0, (sessionMinutes - LOAD_ONSET_MINUTES) / LOAD_ONSET_MINUTES));
        double cognitiveLoad = clamp((Math.min(1.0, variability) + Math.min(1.0, errorRate * 2) + taskSwitch + durationLoad) / 4);
        double engagement = clamp(0.6 * attention + 0.4 * ((double) interactions / n));

        if (!Double.isFinite(variability) || !Double.isFinite(avgResponse) || !Double.isFinite(avgHover)) {
            throw new ModelException("non-finite feature value");
        }

        double stability = stability(previous, idleFrequency, errorRate, helpRate, variability, avgHover);

        return new SessionFeatures(n, sessionMinutes, avgResponse, variance, variability, helpRate, errorRate,
                idleCount, idleFrequency, taskSwitch, avgHover, attention, fatigue, cognitiveLoad, engagement, stability);
    }

    private static double stability(SessionFeatures previous, double idleFrequency, double errorRate,
                                    double helpRate, double variability, double avgHover) {
        if (previous == null || previous.sampleCount() == 0) {
            return 0.5;
        }
        double drift = Math.abs(idleFrequency - previous.idleFrequency())
                + Math.abs(errorRate - previous.errorRate())
                + Math.abs(helpRate - previous.helpRequestRate())
                + Math.abs(Math.min(1.0, variability) - Math.min(1.0, previous.responseTimeVariability()))
                + Math.abs(Math.min(1.0, avgHover / HOVER_SCALE_MS) - Math.min(1.0, previous.avgHoverMs() / HOVER_SCALE_MS));
        return clamp(1 - drift / 5);
    }

    static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        return Math.max(0, Math.min(1, value));
    }
}
