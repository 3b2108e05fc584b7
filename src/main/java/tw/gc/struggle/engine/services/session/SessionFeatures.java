package tw.gc.struggle.engine.services.session;

/**
 * Aggregated behavioral features of one session's rolling window.
 * Rates and cognitive estimates are in [0,1].
 *
 * @param sampleCount              signals in the window
 * @param sessionMinutes           minutes since the session's first signal
 * @param avgResponseTimeMs        mean duration of click/quiz interactions
 * @param responseTimeVariance     population variance of those durations
 * @param responseTimeVariability  coefficient of variation of those durations
 * @param helpRequestRate          help requests per signal
 * @param errorRate                wrong quiz answers per graded quiz answer
 * @param idleCount                idle periods at or above the idle threshold
 * @param idleFrequency            idle periods relative to the saturation count
 * @param taskSwitchFrequency      focus changes and page leaves per signal
 * @param avgHoverMs               mean hover duration
 * @param stability                1 minus the mean drift against the previous features
 */
public record SessionFeatures(
        int sampleCount,
        double sessionMinutes,
        double avgResponseTimeMs,
        double responseTimeVariance,
        double responseTimeVariability,
        double helpRequestRate,
        double errorRate,
        int idleCount,
        double idleFrequency,
        double taskSwitchFrequency,
        double avgHoverMs,
        double attention,
        double fatigue,
        double cognitiveLoad,
        double engagement,
        double stability
) {
    public static final SessionFeatures EMPTY =
            new SessionFeatures(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1, 0, 0, 0, 0);
}
