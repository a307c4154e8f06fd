package in.co.kundli.astro;

/**
 * Sidereal ascendant and midheaven together with the sidereal time they were derived from.
 */
public class ChartAngles {
    private final double ascendant;
    private final double midheaven;
    private final double ramc;
    private final double localSiderealTime;

    public ChartAngles(double ascendant, double midheaven, double ramc, double localSiderealTime) {
        this.ascendant = Angles.normalize(ascendant);
        this.midheaven = Angles.normalize(midheaven);
        this.ramc = ramc;
        this.localSiderealTime = localSiderealTime;
    }

    public double getAscendant() {
        return ascendant;
    }

    public double getMidheaven() {
        return midheaven;
    }

    public double getDescendant() {
        return Angles.normalize(ascendant + Angles.HALF_CIRCLE);
    }

    /**
     * Imum coeli, the point opposite the midheaven.
     */
    public double getImumCoeli() {
        return Angles.normalize(midheaven + Angles.HALF_CIRCLE);
    }

    /**
     * Right ascension of the meridian, degrees.
     */
    public double getRamc() {
        return ramc;
    }

    /**
     * Hours, [0, 24).
     */
    public double getLocalSiderealTime() {
        return localSiderealTime;
    }
}
