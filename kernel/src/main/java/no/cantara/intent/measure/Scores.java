package no.cantara.intent.measure;

/**
 * Integer score arithmetic shared by the engines. Every score is an integer in [0,100].
 */
public final class Scores {

    public static final int MIN = 0;
    public static final int MAX = 100;

    private Scores() {}

    /** Clamp to [0,100] and round half up. */
    public static int clamp(double value) {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("score is NaN");
        }
        return (int) Math.round(Math.max(MIN, Math.min(MAX, value)));
    }

    /** {@code count / ceiling * 100}, clamped. */
    public static int normalize(int count, int ceiling) {
        return clamp((double) count / ceiling * 100);
    }

    public static int weighted(int[] scores, int[] weights) {
        double sum = 0;
        for (int i = 0; i < scores.length; i++) {
            sum += (double) scores[i] * weights[i];
        }
        return clamp(sum / 100);
    }
}
