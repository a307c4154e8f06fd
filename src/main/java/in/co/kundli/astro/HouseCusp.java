package in.co.kundli.astro;

public class HouseCusp {
    private final int house;
    private final double longitude;
    private final ZodiacSign sign;

    public HouseCusp(int house, double longitude) {
        this.house = house;
        this.longitude = Angles.normalize(longitude);
        this.sign = ZodiacSign.fromLongitude(this.longitude);
    }

    public int getHouse() {
        return house;
    }

    public double getLongitude() {
        return longitude;
    }

    public ZodiacSign getSign() {
        return sign;
    }
}
