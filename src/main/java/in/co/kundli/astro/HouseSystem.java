package in.co.kundli.astro;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * House division strategies. Both produce twelve cusps, house 1 first.
 */
public enum HouseSystem {
    /** Each house is one whole sign, starting with the sign holding the ascendant. */
    WHOLE_SIGN("whole_sign"),
    /**
     * Approximate Placidus: houses 1, 4, 7 and 10 sit on the ascendant, IC, descendant and midheaven, and the
     * cusps in between sit at one and two thirds of the difference {@code next - start}, normalized.
     * Not the time-based Placidus division.
     */
    PLACIDUS("placidus");

    public static final int HOUSE_COUNT = 12;

    private final String requestValue;

    HouseSystem(String requestValue) {
        this.requestValue = requestValue;
    }

    public String getRequestValue() {
        return requestValue;
    }

    /**
     * @throws IllegalArgumentException if the value is neither "whole_sign" nor "placidus"
     */
    public static HouseSystem fromRequestValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("house_system must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (HouseSystem system : values()) {
            if (system.requestValue.equals(normalized)) {
                return system;
            }
        }
        throw new IllegalArgumentException("Unsupported house_system: " + value);
    }

    public List<HouseCusp> cusps(ChartAngles angles) {
        switch (this) {
            case WHOLE_SIGN:
                return wholeSign(angles.getAscendant());
            case PLACIDUS:
                return approximatePlacidus(angles);
            default:
                throw new IllegalStateException("Unhandled house system " + this);
        }
    }

    static List<HouseCusp> wholeSign(double ascendant) {
        ZodiacSign first = ZodiacSign.fromLongitude(ascendant);
        List<HouseCusp> cusps = new ArrayList<>(HOUSE_COUNT);
        for (int house = 1; house <= HOUSE_COUNT; house++) {
            cusps.add(new HouseCusp(house, first.plus(house - 1).getStartLongitude()));
        }
        return cusps;
    }

    static List<HouseCusp> approximatePlacidus(ChartAngles angles) {
        // angular cusps of houses 1, 4, 7, 10
        double[] angular = {
                angles.getAscendant(),
                angles.getImumCoeli(),
                angles.getDescendant(),
                angles.getMidheaven()
        };
        List<HouseCusp> cusps = new ArrayList<>(HOUSE_COUNT);
        for (int quadrant = 0; quadrant < angular.length; quadrant++) {
            double start = angular[quadrant];
            // signed numeric difference, not the zodiacal arc: a quadrant whose end is numerically
            // below its start is trisected backwards
            double difference = angular[(quadrant + 1) % angular.length] - start;
            int firstHouse = quadrant * 3 + 1;
            cusps.add(new HouseCusp(firstHouse, start));
            cusps.add(new HouseCusp(firstHouse + 1, start + difference / 3.0));
            cusps.add(new HouseCusp(firstHouse + 2, start + 2.0 * difference / 3.0));
        }
        return cusps;
    }
}
