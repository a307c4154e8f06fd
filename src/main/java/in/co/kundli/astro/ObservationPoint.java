package in.co.kundli.astro;

import java.util.Locale;

public enum ObservationPoint {
    GEOCENTRIC("geocentric"),
    TOPOCENTRIC("topocentric");

    private final String requestValue;

    ObservationPoint(String requestValue) {
        this.requestValue = requestValue;
    }

    public String getRequestValue() {
        return requestValue;
    }

    /**
     * @throws IllegalArgumentException if the value is neither "geocentric" nor "topocentric"
     */
    public static ObservationPoint fromRequestValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("observation_point must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ObservationPoint point : values()) {
            if (point.requestValue.equals(normalized)) {
                return point;
            }
        }
        throw new IllegalArgumentException("Unsupported observation_point: " + value);
    }
}
