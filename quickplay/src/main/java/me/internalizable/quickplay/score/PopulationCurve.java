package me.internalizable.quickplay.score;

import me.internalizable.quickplay.config.QuickplayConfig;

import javax.annotation.Nonnull;

/**
 * Piecewise linear desirability of a server by population.
 *
 * <p>With {@code h = humans + 1} and {@code m' = min(capacity, full)}, the score
 * rises from the minimum anchor at 0 to the low anchor at {@code low}, peaks at
 * the ideal anchor at {@code ideal}, falls to the fuller anchor at {@code m'}
 * and then moves to the final anchor at the true capacity.</p>
 */
public final class PopulationCurve {

    private PopulationCurve() {
    }

    /**
     * Score a population.
     *
     * @param humans current human count, before the joining player
     * @param capacity advertised capacity
     * @param scoring scoring constants
     * @return the population score
     */
    public static double score(int humans, int capacity, @Nonnull QuickplayConfig.ScoringConfig scoring) {
        int h = humans + 1;
        if (h + scoring.getHeadroom() > capacity) {
            return scoring.getRejectionScore();
        }
        if (humans == 0) {
            return scoring.getEmptyPenalty();
        }

        int full = Math.min(capacity, scoring.getFullPlayers());
        int low = nearestEven(full * scoring.getLowFraction());
        int ideal = nearestEven(full * scoring.getIdealFraction());

        if (h <= low) {
            return lerp(0, low, scoring.getScoreMin(), scoring.getScoreLow(), h);
        }
        if (h <= ideal) {
            return lerp(low, ideal, scoring.getScoreLow(), scoring.getScoreIdeal(), h);
        }
        if (h <= full) {
            return lerp(ideal, full, scoring.getScoreIdeal(), scoring.getScoreFuller(), h);
        }
        return lerp(full, capacity, scoring.getScoreFuller(), scoring.getScoreFinal(), h);
    }

    /**
     * Round to the nearest even integer, halves rounding up.
     *
     * @param x value
     * @return nearest even integer
     */
    public static int nearestEven(double x) {
        return 2 * (int) Math.floor(x / 2 + 0.5);
    }

    /**
     * Linear interpolation. A degenerate segment evaluates to its upper anchor.
     */
    static double lerp(double inA, double inB, double outA, double outB, double x) {
        if (inB == inA) {
            return outB;
        }
        return outA + (outB - outA) * (x - inA) / (inB - inA);
    }
}
