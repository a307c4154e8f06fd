package in.co.kundli.astro;

/**
 * The 12 sidereal signs (rashis), each a 30° sector of the ecliptic starting at 0° Aries.
 * Ordinal order is ecliptic order; the ordinal is the sign index.
 */
public enum ZodiacSign {
    ARIES("Aries", "Mesha", Body.MARS, Element.FIRE, Quality.CARDINAL),
    TAURUS("Taurus", "Vrishabha", Body.VENUS, Element.EARTH, Quality.FIXED),
    GEMINI("Gemini", "Mithuna", Body.MERCURY, Element.AIR, Quality.MUTABLE),
    CANCER("Cancer", "Karka", Body.MOON, Element.WATER, Quality.CARDINAL),
    LEO("Leo", "Simha", Body.SUN, Element.FIRE, Quality.FIXED),
    VIRGO("Virgo", "Kanya", Body.MERCURY, Element.EARTH, Quality.MUTABLE),
    LIBRA("Libra", "Tula", Body.VENUS, Element.AIR, Quality.CARDINAL),
    SCORPIO("Scorpio", "Vrishchika", Body.MARS, Element.WATER, Quality.FIXED),
    SAGITTARIUS("Sagittarius", "Dhanu", Body.JUPITER, Element.FIRE, Quality.MUTABLE),
    CAPRICORN("Capricorn", "Makara", Body.SATURN, Element.EARTH, Quality.CARDINAL),
    AQUARIUS("Aquarius", "Kumbha", Body.SATURN, Element.AIR, Quality.FIXED),
    PISCES("Pisces", "Meena", Body.JUPITER, Element.WATER, Quality.MUTABLE);

    public static final double SPAN = 30.0;
    public static final int COUNT = 12;

    private static final ZodiacSign[] SIGNS = values();

    private final String displayName;
    private final String rashi;
    private final Body lord;
    private final Element element;
    private final Quality quality;

    ZodiacSign(String displayName, String rashi, Body lord, Element element, Quality quality) {
        this.displayName = displayName;
        this.rashi = rashi;
        this.lord = lord;
        this.element = element;
        this.quality = quality;
    }

    public enum Element {
        FIRE, EARTH, AIR, WATER
    }

    public enum Quality {
        CARDINAL, FIXED, MUTABLE
    }

    /**
     * Sign for any integer index; wraps modulo 12, so 12 is Aries and -1 is Pisces.
     */
    public static ZodiacSign fromIndex(int index) {
        return SIGNS[Math.floorMod(index, COUNT)];
    }

    public static ZodiacSign fromLongitude(double longitude) {
        return SIGNS[indexOf(longitude)];
    }

    public static int indexOf(double longitude) {
        return Angles.sectorIndex(longitude, SPAN, COUNT);
    }

    /**
     * Position within the sign, [0, 30).
     */
    public static double degreeInSign(double longitude) {
        return Angles.modulo(longitude, SPAN);
    }

    public int getIndex() {
        return ordinal();
    }

    public double getStartLongitude() {
        return ordinal() * SPAN;
    }

    public ZodiacSign plus(int signs) {
        return fromIndex(ordinal() + signs);
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getRashi() {
        return rashi;
    }

    public Body getLord() {
        return lord;
    }

    public Element getElement() {
        return element;
    }

    public Quality getQuality() {
        return quality;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
