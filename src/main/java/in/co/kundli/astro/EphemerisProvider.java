package in.co.kundli.astro;

import java.time.Instant;

/**
 * Source of planetary positions. Implementations must be safe for concurrent use once constructed.
 */
public interface EphemerisProvider {

    /**
     * Apparent tropical ecliptic position of {@code body} at {@code utc}, seen from {@code observer}.
     *
     * @throws IllegalArgumentException if the body is not an ephemeris body (the lunar nodes are derived, not observed)
     */
    EclipticPosition apparentPosition(Body body, Instant utc, Observer observer);
}
