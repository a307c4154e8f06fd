package in.co.kundli.astro;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Circular arithmetic for ecliptic degrees.
 * Every longitude in the engine goes through these helpers so that the 0°/360° seam is handled in one place.
 */
public class Angles {

    public static final double FULL_CIRCLE = 360.0;
    public static final double HALF_CIRCLE = 180.0;

    private Angles() {
    }

    /**
     * Floor modulo: the result takes the sign of the divisor, unlike the % operator.
     */
    public static double modulo(double dividend, double divisor) {
        return dividend - divisor * Math.floor(dividend / divisor);
    }

    /**
     * Normalize a degree value to [0, 360).
     */
    public static double normalize(double degrees) {
        double normalized = modulo(degrees, FULL_CIRCLE);
        // floating point can land exactly on 360 for tiny negative inputs
        return normalized >= FULL_CIRCLE ? 0.0 : normalized;
    }

    /**
     * Round half up to {@code scale} decimal places.
     */
    public static double round(double degrees, int scale) {
        return BigDecimal.valueOf(degrees).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * Round, then normalize again, so 359.9999999 at six places becomes 0.
     */
    public static double roundLongitude(double longitude, int scale) {
        return normalize(round(longitude, scale));
    }

    /**
     * Shortest signed movement from {@code from} to {@code to}, in (-180, 180].
     * A raw delta beyond ±180° is corrected by ∓360°.
     */
    public static double signedDelta(double from, double to) {
        double delta = to - from;
        if (delta > HALF_CIRCLE) {
            delta -= FULL_CIRCLE;
        } else if (delta <= -HALF_CIRCLE) {
            delta += FULL_CIRCLE;
        }
        return delta;
    }

    /**
     * Counter-clockwise (zodiacal order) arc length from {@code from} to {@code to}, in [0, 360).
     */
    public static double forwardArc(double from, double to) {
        return normalize(to - from);
    }

    /**
     * Membership in the half-open arc [start, end) walked in zodiacal order.
     * When end &lt; start the arc straddles 0° and the test becomes {@code x >= start || x < end}.
     */
    public static boolean inHalfOpenArc(double x, double start, double end) {
        if (end < start) {
            return x >= start || x < end;
        }
        return x >= start && x < end;
    }

    /**
     * Index of the fixed-width sector containing {@code longitude}: floor(longitude / span) mod count.
     */
    public static int sectorIndex(double longitude, double span, int count) {
        return Math.floorMod((int) Math.floor(longitude / span), count);
    }

    public static double sin(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    public static double cos(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    public static double tan(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }

    /**
     * atan2 in degrees, normalized to [0, 360).
     */
    public static double atan2(double y, double x) {
        return normalize(Math.toDegrees(Math.atan2(y, x)));
    }
}
