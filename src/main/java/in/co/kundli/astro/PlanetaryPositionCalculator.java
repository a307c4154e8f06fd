package in.co.kundli.astro;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sidereal positions of the seven ephemeris bodies, with daily speed and retrograde flag.
 */
public class PlanetaryPositionCalculator {

    private static final Duration SPEED_SAMPLE_INTERVAL = Duration.ofDays(1);

    private final EphemerisProvider ephemeris;

    public PlanetaryPositionCalculator(EphemerisProvider ephemeris) {
        this.ephemeris = ephemeris;
    }

    /**
     * Positions in output order (Sun, Moon, Mars, Mercury, Jupiter, Venus, Saturn), houses unassigned.
     *
     * @param ayanamsha degrees subtracted from every tropical longitude
     * @throws IllegalStateException if the Sun comes out retrograde
     */
    public List<PlanetPosition> calculate(Instant utc, Observer observer, double ayanamsha) {
        Instant dayBefore = utc.minus(SPEED_SAMPLE_INTERVAL);
        List<PlanetPosition> positions = new ArrayList<>();
        for (Body body : Body.ephemerisBodies()) {
            double now = ephemeris.apparentPosition(body, utc, observer).getLongitude();
            double previous = ephemeris.apparentPosition(body, dayBefore, observer).getLongitude();
            double speed = dailySpeed(previous, now);

            if (body == Body.SUN && speed < 0) {
                throw new IllegalStateException("Sun computed retrograde (" + speed + "°/day) at " + utc);
            }
            positions.add(PlanetPosition.of(body, now - ayanamsha, speed));
        }
        return positions;
    }

    /**
     * Degrees per day between two samples one day apart, corrected across the 0°/360° seam.
     */
    static double dailySpeed(double previousLongitude, double currentLongitude) {
        return Angles.signedDelta(previousLongitude, currentLongitude) / SPEED_SAMPLE_INTERVAL.toDays();
    }
}
