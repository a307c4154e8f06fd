package in.co.kundli.astro;

/**
 * Apparent tropical ecliptic coordinates of date. Longitude is in [0, 360), distance in AU.
 */
public class EclipticPosition {
    // WARNING! Latitude and distance are not validated
    private final double longitude;
    private final double latitude;
    private final double distance;

    public EclipticPosition(double longitude, double latitude, double distance) {
        this.longitude = Angles.normalize(longitude);
        this.latitude = latitude;
        this.distance = distance;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getDistance() {
        return distance;
    }
}
