package in.co.kundli.astro;

import in.co.kundli.services.LoggingService;

/**
 * Tropical to sidereal correction.
 *
 * Lahiri: Ayanamsha(t) = 23.85° + 50.26" × (years since 1950-01-01 0h UT)
 */
public class AyanamshaCalculator {

    /** Jan 1, 1950, 0h UT */
    public static final double JD_1950 = 2433282.5;
    public static final double LAHIRI_AT_1950 = 23.85;
    public static final double PRECESSION_ARCSEC_PER_YEAR = 50.26;
    public static final double DAYS_PER_JULIAN_YEAR = 365.25;

    private AyanamshaCalculator() {
    }

    public static double lahiri(double julianDate) {
        double yearsSince1950 = (julianDate - JD_1950) / DAYS_PER_JULIAN_YEAR;
        return LAHIRI_AT_1950 + (PRECESSION_ARCSEC_PER_YEAR / 3600.0) * yearsSince1950;
    }

    /**
     * Resolve the requested system for a Julian Date. Systems other than Lahiri are computed as Lahiri
     * and reported at WARN level; this is not an error.
     */
    public static AyanamshaResult calculate(Ayanamsha requested, double julianDate) {
        double value = lahiri(julianDate);
        if (requested != Ayanamsha.LAHIRI) {
            LoggingService.warn("ayanamsha_fallback_to_lahiri",
                    LoggingService.data("requested", requested.getRequestValue(), "applied", Ayanamsha.LAHIRI.getRequestValue()));
        }
        return new AyanamshaResult(requested, Ayanamsha.LAHIRI, value);
    }
}
