package tw.gc.struggle.engine.services.scoring;

import tw.gc.struggle.engine.enums.StruggleFactor;

/**
 * One factor's share of a risk score.
 *
 * @param rawValue      the feature value fed in
 * @param intensity     normalised to [0,1], zero below the noise floor
 * @param contribution  weighted intensity
 * @param crossedThreshold whether the raw value reached the factor's reporting threshold
 */
public record FactorContribution(StruggleFactor factor, double rawValue, double intensity,
                                 double contribution, boolean crossedThreshold) {
}
