package in.co.kundli.astro;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class PlanetaryPositionCalculatorTest {

    private static final Instant NOW = Instant.parse("2024-03-20T06:30:00Z");
    private static final Instant DAY_BEFORE = NOW.minus(1, ChronoUnit.DAYS);
    private static final Observer OBSERVER = Observer.geocentric(19.07, 72.88);

    /**
     * Fake ephemeris: fixed tropical longitudes now and one day earlier.
     */
    private static EphemerisProvider fixed(Map<Body, double[]> previousAndNow) {
        return (body, utc, observer) -> {
            double[] samples = previousAndNow.get(body);
            double longitude = utc.equals(NOW) ? samples[1] : samples[0];
            return new EclipticPosition(longitude, 0.0, 1.0);
        };
    }

    private static Map<Body, double[]> steadyMotion() {
        Map<Body, double[]> samples = new EnumMap<>(Body.class);
        samples.put(Body.SUN, new double[]{359.0, 0.0});
        samples.put(Body.MOON, new double[]{100.0, 113.0});
        samples.put(Body.MARS, new double[]{200.0, 200.7});
        samples.put(Body.MERCURY, new double[]{10.5, 10.0});
        samples.put(Body.JUPITER, new double[]{0.2, 359.9});
        samples.put(Body.VENUS, new double[]{300.0, 301.2});
        samples.put(Body.SATURN, new double[]{330.0, 330.1});
        return samples;
    }

    @Test
    public void test_bodiesInOutputOrder() {
        List<PlanetPosition> positions = new PlanetaryPositionCalculator(fixed(steadyMotion())).calculate(NOW, OBSERVER, 24.0);
        assertEquals(List.of(Body.SUN, Body.MOON, Body.MARS, Body.MERCURY, Body.JUPITER, Body.VENUS, Body.SATURN),
                positions.stream().map(PlanetPosition::getBody).toList());
        for (PlanetPosition position : positions) {
            assertEquals(PlanetPosition.UNASSIGNED_HOUSE, position.getHouse());
        }
    }

    @Test
    public void test_siderealIsTropicalMinusAyanamsha_wrapped() {
        List<PlanetPosition> positions = new PlanetaryPositionCalculator(fixed(steadyMotion())).calculate(NOW, OBSERVER, 24.0);
        // Sun at 0° tropical becomes 336° sidereal
        assertEquals(336.0, positions.get(0).getLongitude(), 1e-9);
        assertEquals(ZodiacSign.PISCES, positions.get(0).getSign());
        assertEquals(6.0, positions.get(0).getDegreeInSign(), 1e-9);
        assertEquals(89.0, positions.get(1).getLongitude(), 1e-9);
    }

    @Test
    public void test_speedAcrossZero_isNotA360DegreeJump() {
        List<PlanetPosition> positions = new PlanetaryPositionCalculator(fixed(steadyMotion())).calculate(NOW, OBSERVER, 24.0);
        PlanetPosition sun = positions.get(0);
        assertEquals(1.0, sun.getSpeed(), 1e-9);
        assertFalse(sun.isRetrograde());

        PlanetPosition jupiter = positions.get(4);
        assertEquals(-0.3, jupiter.getSpeed(), 1e-9);
        assertTrue(jupiter.isRetrograde());
    }

    @Test
    public void test_negativeSpeed_isRetrograde() {
        PlanetPosition mercury = new PlanetaryPositionCalculator(fixed(steadyMotion())).calculate(NOW, OBSERVER, 0.0).get(3);
        assertEquals(-0.5, mercury.getSpeed(), 1e-9);
        assertTrue(mercury.isRetrograde());
    }

    @Test
    public void test_retrogradeSun_isRejected() {
        Map<Body, double[]> samples = steadyMotion();
        samples.put(Body.SUN, new double[]{0.5, 359.5});
        PlanetaryPositionCalculator calculator = new PlanetaryPositionCalculator(fixed(samples));
        assertThrows(IllegalStateException.class, () -> calculator.calculate(NOW, OBSERVER, 24.0));
    }

    @Test
    public void test_samplesEphemerisNowAndOneDayEarlier() {
        EphemerisProvider provider = mock(EphemerisProvider.class);
        when(provider.apparentPosition(any(), any(), any())).thenReturn(new EclipticPosition(10.0, 0.0, 1.0));

        new PlanetaryPositionCalculator(provider).calculate(NOW, OBSERVER, 24.0);

        for (Body body : Body.ephemerisBodies()) {
            verify(provider).apparentPosition(body, NOW, OBSERVER);
            verify(provider).apparentPosition(body, DAY_BEFORE, OBSERVER);
        }
        verify(provider, never()).apparentPosition(eq(Body.RAHU), any(), any());
        verifyNoMoreInteractions(provider);
    }

    @Test
    public void test_sunNeverRetrograde_withRealEphemeris() {
        PlanetaryPositionCalculator calculator = new PlanetaryPositionCalculator(new EphemerisDataLoader(null).call());
        Instant instant = Instant.parse("1800-01-01T00:00:00Z");
        while (instant.isBefore(Instant.parse("2200-01-01T00:00:00Z"))) {
            PlanetPosition sun = calculator.calculate(instant, OBSERVER, AyanamshaCalculator.lahiri(TimeConversion.toJulianDate(instant))).get(0);
            assertFalse(sun.isRetrograde(), "Sun retrograde at " + instant);
            assertTrue(sun.getSpeed() > 0.9 && sun.getSpeed() < 1.1, "Sun speed " + sun.getSpeed() + " at " + instant);
            instant = instant.plus(37, ChronoUnit.DAYS);
        }
    }
}
