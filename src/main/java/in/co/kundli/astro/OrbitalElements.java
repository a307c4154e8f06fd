package in.co.kundli.astro;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Keplerian mean elements of one heliocentric orbit at J2000 with their rates per Julian century.
 * Angles in degrees, semi-major axis in AU.
 */
public class OrbitalElements {
    private final double[] semiMajorAxis;
    private final double[] eccentricity;
    private final double[] inclination;
    private final double[] meanLongitude;
    private final double[] perihelionLongitude;
    private final double[] ascendingNodeLongitude;

    public OrbitalElements(double[] semiMajorAxis, double[] eccentricity, double[] inclination,
                           double[] meanLongitude, double[] perihelionLongitude, double[] ascendingNodeLongitude) {
        this.semiMajorAxis = semiMajorAxis;
        this.eccentricity = eccentricity;
        this.inclination = inclination;
        this.meanLongitude = meanLongitude;
        this.perihelionLongitude = perihelionLongitude;
        this.ascendingNodeLongitude = ascendingNodeLongitude;
    }

    /**
     * Read one body's entry; each element is a two-item array [value at J2000, rate per century].
     *
     * @throws IllegalArgumentException if an element is missing or not a pair of numbers
     */
    public static OrbitalElements fromJson(String bodyKey, JsonNode node) {
        return new OrbitalElements(
                pair(bodyKey, node, "a"),
                pair(bodyKey, node, "e"),
                pair(bodyKey, node, "i"),
                pair(bodyKey, node, "meanLongitude"),
                pair(bodyKey, node, "perihelionLongitude"),
                pair(bodyKey, node, "ascendingNodeLongitude"));
    }

    private static double[] pair(String bodyKey, JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isArray() || value.size() != 2 || !value.get(0).isNumber() || !value.get(1).isNumber()) {
            throw new IllegalArgumentException("Element '" + field + "' of '" + bodyKey + "' must be [value, ratePerCentury]");
        }
        return new double[]{value.get(0).asDouble(), value.get(1).asDouble()};
    }

    private static double at(double[] element, double centuries) {
        return element[0] + element[1] * centuries;
    }

    /**
     * Heliocentric ecliptic rectangular coordinates (J2000 ecliptic and equinox) in AU.
     */
    public double[] heliocentricPosition(double centuries) {
        double a = at(semiMajorAxis, centuries);
        double e = at(eccentricity, centuries);
        double i = at(inclination, centuries);
        double l = at(meanLongitude, centuries);
        double varpi = at(perihelionLongitude, centuries);
        double omega = at(ascendingNodeLongitude, centuries);

        double argumentOfPerihelion = varpi - omega;
        double meanAnomaly = Angles.modulo(l - varpi + 180.0, 360.0) - 180.0;
        double eccentricAnomaly = solveKepler(meanAnomaly, e);

        // coordinates in the orbital plane, x towards perihelion
        double xOrbit = a * (Angles.cos(eccentricAnomaly) - e);
        double yOrbit = a * Math.sqrt(1 - e * e) * Angles.sin(eccentricAnomaly);

        double cw = Angles.cos(argumentOfPerihelion);
        double sw = Angles.sin(argumentOfPerihelion);
        double cO = Angles.cos(omega);
        double sO = Angles.sin(omega);
        double cI = Angles.cos(i);
        double sI = Angles.sin(i);

        double x = (cw * cO - sw * sO * cI) * xOrbit + (-sw * cO - cw * sO * cI) * yOrbit;
        double y = (cw * sO + sw * cO * cI) * xOrbit + (-sw * sO + cw * cO * cI) * yOrbit;
        double z = (sw * sI) * xOrbit + (cw * sI) * yOrbit;
        return new double[]{x, y, z};
    }

    /**
     * Kepler's equation M = E - e sin E by Newton iteration, degrees in and out.
     */
    static double solveKepler(double meanAnomaly, double e) {
        double eStar = Math.toDegrees(e);
        double eccentricAnomaly = meanAnomaly + eStar * Angles.sin(meanAnomaly);
        for (int iteration = 0; iteration < 30; iteration++) {
            double deltaM = meanAnomaly - (eccentricAnomaly - eStar * Angles.sin(eccentricAnomaly));
            double deltaE = deltaM / (1 - e * Angles.cos(eccentricAnomaly));
            eccentricAnomaly += deltaE;
            if (Math.abs(deltaE) < 1e-9) {
                break;
            }
        }
        return eccentricAnomaly;
    }
}
