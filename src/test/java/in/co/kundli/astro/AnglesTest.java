package in.co.kundli.astro;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class AnglesTest {

    private static final double DELTA = 1e-9;

    @ParameterizedTest
    @CsvSource({
            "0, 0",
            "360, 0",
            "-30, 330",
            "725, 5",
            "-720, 0",
            "359.5, 359.5"
    })
    public void test_normalize_landsInFullCircle(double input, double expected) {
        assertEquals(expected, Angles.normalize(input), DELTA);
    }

    @Test
    public void test_normalize_tinyNegative_neverReturns360() {
        double normalized = Angles.normalize(-1e-15);
        assertTrue(normalized >= 0 && normalized < 360, "got " + normalized);
    }

    @Test
    public void test_modulo_takesSignOfDivisor() {
        assertEquals(23.0, Angles.modulo(-1.0, 24.0), DELTA);
        assertEquals(1.0, Angles.modulo(25.0, 24.0), DELTA);
    }

    @ParameterizedTest
    @CsvSource({
            "359.5, 0.5, 1.0",
            "0.5, 359.5, -1.0",
            "10, 20, 10",
            "20, 10, -10",
            "0, 180, 180",
            "180, 0, 180"
    })
    public void test_signedDelta_correctsAcrossSeam(double from, double to, double expected) {
        assertEquals(expected, Angles.signedDelta(from, to), DELTA);
    }

    @Test
    public void test_forwardArc_alwaysZodiacalDirection() {
        assertEquals(20.0, Angles.forwardArc(350.0, 10.0), DELTA);
        assertEquals(340.0, Angles.forwardArc(10.0, 350.0), DELTA);
        assertEquals(0.0, Angles.forwardArc(42.0, 42.0), DELTA);
    }

    @Test
    public void test_inHalfOpenArc_normalOrdering() {
        assertTrue(Angles.inHalfOpenArc(30.0, 30.0, 60.0));
        assertTrue(Angles.inHalfOpenArc(59.999, 30.0, 60.0));
        assertFalse(Angles.inHalfOpenArc(60.0, 30.0, 60.0));
        assertFalse(Angles.inHalfOpenArc(29.999, 30.0, 60.0));
    }

    @Test
    public void test_inHalfOpenArc_straddlingZero() {
        assertTrue(Angles.inHalfOpenArc(355.0, 350.0, 20.0));
        assertTrue(Angles.inHalfOpenArc(0.0, 350.0, 20.0));
        assertTrue(Angles.inHalfOpenArc(19.9, 350.0, 20.0));
        assertFalse(Angles.inHalfOpenArc(20.0, 350.0, 20.0));
        assertFalse(Angles.inHalfOpenArc(180.0, 350.0, 20.0));
    }

    @Test
    public void test_sectorIndex_floorThenWrap() {
        assertEquals(0, Angles.sectorIndex(0.0, 30.0, 12));
        assertEquals(11, Angles.sectorIndex(359.999, 30.0, 12));
        assertEquals(0, Angles.sectorIndex(360.0, 30.0, 12));
        assertEquals(11, Angles.sectorIndex(-1.0, 30.0, 12));
    }

    @Test
    public void test_atan2_normalizedDegrees() {
        assertEquals(90.0, Angles.atan2(1.0, 0.0), DELTA);
        assertEquals(270.0, Angles.atan2(-1.0, 0.0), DELTA);
        assertEquals(180.0, Angles.atan2(0.0, -1.0), DELTA);
    }

    @Test
    public void test_round_halfUpAndRenormalized() {
        assertEquals(12.345679, Angles.round(12.3456785, 6), 1e-12);
        assertEquals(30.0, Angles.roundLongitude(29.9999997, 6), 0.0);
        assertEquals(0.0, Angles.roundLongitude(359.99999996, 6), 0.0);
        assertEquals(359.999999, Angles.roundLongitude(359.999999, 6), 1e-12);
    }
}
