package in.co.kundli.astro;

import in.co.kundli.services.ChartServiceConfig;

import java.time.LocalDateTime;

/**
 * Sidereal ascendant and midheaven.
 *
 * With RAMC = LST × 15 and mean obliquity ε:
 * <pre>
 * ascendant = atan2(-cos RAMC, sin RAMC · cos ε + tan φ · sin ε)
 * midheaven = atan2(tan RAMC, cos ε)
 * </pre>
 * both normalized and reduced by the ayanamsha.
 */
public class AscendantCalculator {

    private AscendantCalculator() {
    }

    /**
     * @throws IllegalArgumentException at or beyond the poles, where tan φ is undefined
     */
    public static ChartAngles calculate(double julianDate, double latitude, double longitude, double ayanamsha) {
        if (Double.isNaN(latitude) || Math.abs(latitude) >= 90.0) {
            throw new IllegalArgumentException("Ascendant is undefined at latitude " + latitude);
        }
        double epsilon = ChartServiceConfig.MEAN_OBLIQUITY_DEGREES;
        double lst = TimeConversion.localSiderealTime(julianDate, longitude);
        double ramc = lst * 15.0;

        double ascendant = Angles.atan2(-Angles.cos(ramc),
                Angles.sin(ramc) * Angles.cos(epsilon) + Angles.tan(latitude) * Angles.sin(epsilon));
        double midheaven = Angles.atan2(Angles.tan(ramc), Angles.cos(epsilon));

        return new ChartAngles(ascendant - ayanamsha, midheaven - ayanamsha, ramc, lst);
    }

    public static ChartAngles calculate(LocalDateTime utc, double latitude, double longitude, double ayanamsha) {
        return calculate(TimeConversion.toJulianDate(utc), latitude, longitude, ayanamsha);
    }
}
