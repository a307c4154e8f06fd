package in.co.kundli.astro;

/**
 * Sidereal placement of one body. The house is {@link #UNASSIGNED_HOUSE} until houses have been computed.
 */
public class PlanetPosition {

    public static final int UNASSIGNED_HOUSE = 0;

    private final Body body;
    private final double longitude;
    private final double speed;
    private final boolean retrograde;
    private final ZodiacSign sign;
    private final Nakshatra nakshatra;
    private final int pada;
    private final int house;

    private PlanetPosition(Body body, double longitude, double speed, boolean retrograde, int house) {
        this.body = body;
        this.longitude = Angles.normalize(longitude);
        this.speed = speed;
        this.retrograde = retrograde;
        this.sign = ZodiacSign.fromLongitude(this.longitude);
        this.nakshatra = Nakshatra.fromLongitude(this.longitude);
        this.pada = Nakshatra.padaOf(this.longitude);
        this.house = house;
    }

    /**
     * Unassigned position; retrograde iff speed is negative.
     */
    public static PlanetPosition of(Body body, double siderealLongitude, double speed) {
        return new PlanetPosition(body, siderealLongitude, speed, speed < 0, UNASSIGNED_HOUSE);
    }

    /**
     * Unassigned position with an explicit retrograde flag, for the lunar nodes.
     */
    public static PlanetPosition of(Body body, double siderealLongitude, double speed, boolean retrograde) {
        return new PlanetPosition(body, siderealLongitude, speed, retrograde, UNASSIGNED_HOUSE);
    }

    public PlanetPosition withHouse(int house) {
        if (house < 1 || house > 12) {
            throw new IllegalArgumentException("House must be 1..12, got " + house);
        }
        return new PlanetPosition(body, longitude, speed, retrograde, house);
    }

    public Body getBody() {
        return body;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getDegreeInSign() {
        return ZodiacSign.degreeInSign(longitude);
    }

    public double getSpeed() {
        return speed;
    }

    public boolean isRetrograde() {
        return retrograde;
    }

    public ZodiacSign getSign() {
        return sign;
    }

    public Nakshatra getNakshatra() {
        return nakshatra;
    }

    public int getPada() {
        return pada;
    }

    public int getHouse() {
        return house;
    }

    @Override
    public String toString() {
        return body + " " + sign + " " + String.format("%.4f", getDegreeInSign()) + (retrograde ? " R" : "") + " house " + house;
    }
}
