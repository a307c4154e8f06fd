package in.co.kundli.astro;

/**
 * Where the chart is cast from: geographic coordinates in degrees (north and east positive).
 */
public class Observer {
    private final double latitude;
    private final double longitude;
    private final ObservationPoint observationPoint;

    public Observer(double latitude, double longitude, ObservationPoint observationPoint) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.observationPoint = observationPoint;
    }

    public static Observer geocentric(double latitude, double longitude) {
        return new Observer(latitude, longitude, ObservationPoint.GEOCENTRIC);
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public ObservationPoint getObservationPoint() {
        return observationPoint;
    }

    public boolean isTopocentric() {
        return observationPoint == ObservationPoint.TOPOCENTRIC;
    }
}
