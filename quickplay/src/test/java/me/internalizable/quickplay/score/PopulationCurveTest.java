package me.internalizable.quickplay.score;

import me.internalizable.quickplay.config.QuickplayConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PopulationCurve Tests")
class PopulationCurveTest {

    private static final double EPSILON = 1e-9;

    private final QuickplayConfig.ScoringConfig scoring = new QuickplayConfig.ScoringConfig();

    @Test
    @DisplayName("Nearest even rounds halves up")
    void testNearestEven() {
        assertEquals(8, PopulationCurve.nearestEven(8.0));
        assertEquals(18, PopulationCurve.nearestEven(17.28));
        assertEquals(6, PopulationCurve.nearestEven(5.0));
        assertEquals(4, PopulationCurve.nearestEven(4.9));
        assertEquals(0, PopulationCurve.nearestEven(0.9));
    }

    @Test
    @DisplayName("Peak sits at the ideal population of a full size server")
    void testPeak() {
        assertEquals(1.6, PopulationCurve.score(17, 24, scoring), EPSILON);
        assertTrue(PopulationCurve.score(16, 24, scoring) < 1.6);
        assertTrue(PopulationCurve.score(18, 24, scoring) < 1.6);
    }

    @Test
    @DisplayName("No room for the joining player and its headroom is rejected")
    void testHeadroom() {
        assertEquals(-100.0, PopulationCurve.score(23, 24, scoring));
        assertEquals(-100.0, PopulationCurve.score(24, 24, scoring));
        assertTrue(PopulationCurve.score(22, 24, scoring) > -100.0);
    }

    @Test
    @DisplayName("Empty servers get the empty penalty")
    void testEmpty() {
        assertEquals(-0.3, PopulationCurve.score(0, 24, scoring));
        assertEquals(-0.3, PopulationCurve.score(0, 32, scoring));
    }

    @Test
    @DisplayName("Score rises monotonically up to the ideal population")
    void testMonotonicRise() {
        double previous = PopulationCurve.score(1, 24, scoring);
        for (int humans = 2; humans <= 17; humans++) {
            double current = PopulationCurve.score(humans, 24, scoring);
            assertTrue(current > previous, "humans=" + humans);
            previous = current;
        }
    }

    @Test
    @DisplayName("Segment values at the anchors")
    void testAnchors() {
        // h = 8 is the low anchor of a 24 slot server
        assertEquals(0.1, PopulationCurve.score(7, 24, scoring), EPSILON);
        assertEquals(0.025, PopulationCurve.score(1, 24, scoring), EPSILON);
        assertEquals(1.6 - 1.4 * 5 / 6, PopulationCurve.score(22, 24, scoring), EPSILON);
    }

    @Test
    @DisplayName("Servers above the full size continue to the final anchor")
    void testIncreasedCapacity() {
        assertEquals(0.2, PopulationCurve.score(23, 32, scoring), EPSILON);
        assertEquals(0.075, PopulationCurve.score(25, 32, scoring), EPSILON);
        assertEquals(-100.0, PopulationCurve.score(31, 32, scoring));
    }

    @Test
    @DisplayName("Degenerate segment evaluates to its upper anchor")
    void testDegenerateLerp() {
        assertEquals(0.7, PopulationCurve.lerp(3, 3, 0.2, 0.7, 3));
        assertEquals(0.5, PopulationCurve.lerp(0, 10, 0.0, 1.0, 5), EPSILON);
    }
}
