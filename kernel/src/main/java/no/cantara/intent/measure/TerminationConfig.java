package no.cantara.intent.measure;

/**
 * Thresholds for {@link TerminationPolicy}.
 *
 * @param minDensity minimum density score for a terminal node
 * @param maxEntropy maximum entropy score for a terminal node
 * @param minRatio   minimum density/entropy ratio when entropy is non-zero
 */
public record TerminationConfig(int minDensity, int maxEntropy, double minRatio) {

    public static final TerminationConfig DEFAULTS = new TerminationConfig(60, 30, 2.0);

    public TerminationConfig {
        if (minDensity < Scores.MIN || minDensity > Scores.MAX) {
            throw new IllegalArgumentException("min_density must be within 0..100, got " + minDensity);
        }
        if (maxEntropy < Scores.MIN || maxEntropy > Scores.MAX) {
            throw new IllegalArgumentException("max_entropy must be within 0..100, got " + maxEntropy);
        }
        if (!(minRatio >= 0) || Double.isInfinite(minRatio)) {
            throw new IllegalArgumentException("min_ratio must be a non-negative number, got " + minRatio);
        }
    }
}
