package no.cantara.intent.measure;

import no.cantara.intent.model.DensityMeasurement;
import no.cantara.intent.model.EntropyMeasurement;

/**
 * Decides whether a node is concrete enough to stop decomposing.
 */
public final class TerminationPolicy {

    private TerminationPolicy() {}

    public static boolean isTerminal(EntropyMeasurement entropy, DensityMeasurement density) {
        return isTerminal(entropy.entropyScore(), density.densityScore(), TerminationConfig.DEFAULTS);
    }

    public static boolean isTerminal(EntropyMeasurement entropy, DensityMeasurement density,
                                     TerminationConfig config) {
        return isTerminal(entropy.entropyScore(), density.densityScore(), config);
    }

    /**
     * Terminal iff density meets the minimum, entropy stays under the maximum and
     * either entropy is zero or the density/entropy ratio reaches {@code minRatio}.
     * For fixed density, lowering entropy never flips a terminal verdict.
     */
    public static boolean isTerminal(int entropyScore, int densityScore, TerminationConfig config) {
        if (densityScore < config.minDensity()) {
            return false;
        }
        if (entropyScore > config.maxEntropy()) {
            return false;
        }
        if (entropyScore == 0) {
            return true;
        }
        return (double) densityScore / entropyScore >= config.minRatio();
    }

    /**
     * Expected value of asking a question at a node: {@code 0.6*entropy + 0.4*(100 - density)}.
     * Ranks candidate questions; it does not gate termination.
     */
    public static int informationGain(EntropyMeasurement entropy, DensityMeasurement density) {
        return informationGain(entropy.entropyScore(), density.densityScore());
    }

    public static int informationGain(int entropyScore, int densityScore) {
        return Scores.clamp(0.6 * entropyScore + 0.4 * (Scores.MAX - densityScore));
    }
}
