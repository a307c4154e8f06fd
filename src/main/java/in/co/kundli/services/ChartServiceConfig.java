package in.co.kundli.services;

import in.co.kundli.astro.Ayanamsha;
import in.co.kundli.astro.HouseSystem;
import in.co.kundli.astro.ObservationPoint;

/**
 * Configuration class for the birth chart service
 * Contains constants for the calculation engine and the ephemeris data location
 */
public class ChartServiceConfig {

    public static final String SERVICE_NAME = "kundli-lambda";
    public static final String SERVICE_VERSION = "1.0.0";
    public static final String API_PREFIX = "/api/v1/";

    // Fixed mean obliquity of the ecliptic, degrees
    public static final double MEAN_OBLIQUITY_DEGREES = 23.4397;

    // Nominal daily regression of the lunar nodes, degrees/day
    public static final double LUNAR_NODE_SPEED = -0.053;

    // Decimal places kept for every degree value in responses
    public static final int DEGREE_SCALE = 6;

    // Request defaults
    public static final ObservationPoint DEFAULT_OBSERVATION_POINT = ObservationPoint.TOPOCENTRIC;
    public static final Ayanamsha DEFAULT_AYANAMSHA = Ayanamsha.LAHIRI;
    public static final HouseSystem DEFAULT_HOUSE_SYSTEM = HouseSystem.WHOLE_SIGN;
    public static final int DEFAULT_SECONDS = 0;

    // Request limits
    public static final int MIN_YEAR = 1800;
    public static final int MAX_YEAR = 2200;
    public static final double MIN_TIMEZONE = -12.0;
    public static final double MAX_TIMEZONE = 14.0;

    // Ephemeris data location
    public static final String EPHEMERIS_PATH_ENV = "KUNDLI_EPHEMERIS_PATH";
    public static final String EPHEMERIS_PATH_PROPERTY = "kundli.ephemeris.path";
    public static final String EPHEMERIS_CLASSPATH_RESOURCE = "ephemeris/orbital-elements.json";

    /**
     * External ephemeris data file, if one is configured. The environment variable wins over the system property.
     * Returns null when the bundled classpath resource should be used.
     */
    public static String getEphemerisPath() {
        String path = System.getenv(EPHEMERIS_PATH_ENV);
        if (path == null || path.isBlank()) {
            path = System.getProperty(EPHEMERIS_PATH_PROPERTY);
        }
        return path == null || path.isBlank() ? null : path.trim();
    }
}
