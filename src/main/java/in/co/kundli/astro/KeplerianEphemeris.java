package in.co.kundli.astro;

import com.fasterxml.jackson.databind.JsonNode;
import in.co.kundli.services.ChartServiceConfig;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Analytic ephemeris: planets from mean Keplerian elements, the Moon from {@link LunarTheory}.
 *
 * Positions are corrected for light-time and precessed from J2000 to the equinox of date.
 * Aberration and nutation are not modelled; together they stay below 0.01°.
 */
public class KeplerianEphemeris implements EphemerisProvider {

    private static final double LIGHT_TIME_DAYS_PER_AU = 0.0057755183;
    // sine of the Sun's horizontal parallax at 1 AU (8.794")
    private static final double SIN_SOLAR_PARALLAX = Math.sin(Math.toRadians(8.794 / 3600.0));
    // polar axis / equatorial axis of the reference ellipsoid
    private static final double EARTH_FLATTENING_RATIO = 0.99664719;

    private final OrbitalElements earth;
    private final Map<Body, OrbitalElements> planets;

    public KeplerianEphemeris(OrbitalElements earth, Map<Body, OrbitalElements> planets) {
        this.earth = earth;
        this.planets = new EnumMap<>(planets);
        for (Body body : new Body[]{Body.MERCURY, Body.VENUS, Body.MARS, Body.JUPITER, Body.SATURN}) {
            if (!this.planets.containsKey(body)) {
                throw new IllegalArgumentException("Missing orbital elements for " + body);
            }
        }
    }

    /**
     * Build from the parsed data file: an "elements" object keyed by lowercase body name plus "earth".
     *
     * @throws IllegalArgumentException if the document lacks a required body or element
     */
    public static KeplerianEphemeris fromJson(JsonNode rootNode) {
        JsonNode elementsNode = rootNode.path("elements");
        if (!elementsNode.isObject()) {
            throw new IllegalArgumentException("Ephemeris data has no 'elements' object");
        }
        OrbitalElements earth = null;
        Map<Body, OrbitalElements> planets = new EnumMap<>(Body.class);
        Iterator<Map.Entry<String, JsonNode>> fields = elementsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            OrbitalElements elements = OrbitalElements.fromJson(key, field.getValue());
            if ("earth".equals(key)) {
                earth = elements;
            } else {
                planets.put(Body.valueOf(key.toUpperCase(Locale.ROOT)), elements);
            }
        }
        if (earth == null) {
            throw new IllegalArgumentException("Missing orbital elements for earth");
        }
        return new KeplerianEphemeris(earth, planets);
    }

    @Override
    public EclipticPosition apparentPosition(Body body, Instant utc, Observer observer) {
        if (body.isLunarNode()) {
            throw new IllegalArgumentException(body + " is derived from the Moon, not observed");
        }
        double julianDate = TimeConversion.toJulianDate(utc);
        EclipticPosition geocentric = body == Body.MOON
                ? LunarTheory.position(julianDate)
                : planetOrSun(body, julianDate);
        if (observer != null && observer.isTopocentric()) {
            return toTopocentric(geocentric, julianDate, observer);
        }
        return geocentric;
    }

    private EclipticPosition planetOrSun(Body body, double julianDate) {
        double centuries = TimeConversion.julianCenturies(julianDate);
        double[] earthPosition = earth.heliocentricPosition(centuries);

        double[] geocentric;
        if (body == Body.SUN) {
            geocentric = new double[]{-earthPosition[0], -earthPosition[1], -earthPosition[2]};
        } else {
            OrbitalElements elements = planets.get(body);
            geocentric = subtract(elements.heliocentricPosition(centuries), earthPosition);
            // planet where it was when the light left it
            double lightTimeCenturies = length(geocentric) * LIGHT_TIME_DAYS_PER_AU / TimeConversion.DAYS_PER_JULIAN_CENTURY;
            geocentric = subtract(elements.heliocentricPosition(centuries - lightTimeCenturies), earthPosition);
        }

        double distance = length(geocentric);
        double longitudeJ2000 = Angles.atan2(geocentric[1], geocentric[0]);
        double latitude = Math.toDegrees(Math.asin(geocentric[2] / distance));
        return new EclipticPosition(longitudeJ2000 + generalPrecession(centuries), latitude, distance);
    }

    /**
     * Accumulated precession in longitude since J2000, degrees.
     */
    static double generalPrecession(double centuries) {
        return (5029.0966 * centuries + 1.11113 * centuries * centuries) / 3600.0;
    }

    /**
     * Parallax correction in ecliptic coordinates for an observer at sea level.
     */
    static EclipticPosition toTopocentric(EclipticPosition geocentric, double julianDate, Observer observer) {
        double epsilon = ChartServiceConfig.MEAN_OBLIQUITY_DEGREES;
        double siderealDegrees = TimeConversion.localSiderealTime(julianDate, observer.getLongitude()) * 15.0;

        double u = Math.toDegrees(Math.atan(EARTH_FLATTENING_RATIO * Angles.tan(observer.getLatitude())));
        double rhoSinPhi = EARTH_FLATTENING_RATIO * Angles.sin(u);
        double rhoCosPhi = Angles.cos(u);

        double sinParallax = SIN_SOLAR_PARALLAX / geocentric.getDistance();
        double lambda = geocentric.getLongitude();
        double beta = geocentric.getLatitude();

        double n = Angles.cos(lambda) * Angles.cos(beta) - rhoCosPhi * sinParallax * Angles.cos(siderealDegrees);
        double y = Angles.sin(lambda) * Angles.cos(beta)
                - sinParallax * (rhoSinPhi * Angles.sin(epsilon) + rhoCosPhi * Angles.cos(epsilon) * Angles.sin(siderealDegrees));
        double topocentricLongitude = Angles.atan2(y, n);
        double topocentricLatitude = Math.toDegrees(Math.atan(Angles.cos(topocentricLongitude)
                * (Angles.sin(beta) - sinParallax * (rhoSinPhi * Angles.cos(epsilon) - rhoCosPhi * Angles.sin(epsilon) * Angles.sin(siderealDegrees)))
                / n));
        return new EclipticPosition(topocentricLongitude, topocentricLatitude, geocentric.getDistance());
    }

    private static double[] subtract(double[] a, double[] b) {
        return new double[]{a[0] - b[0], a[1] - b[1], a[2] - b[2]};
    }

    private static double length(double[] v) {
        return Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
    }
}
