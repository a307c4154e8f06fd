package in.co.kundli.astro;

/**
 * The 27 lunar mansions, each 13°20' wide and split into four padas of 3°20'.
 * Lords follow the Vimshottari sequence Ketu, Venus, Sun, Moon, Mars, Rahu, Jupiter, Saturn, Mercury, three times over.
 */
public enum Nakshatra {
    ASHWINI("Ashwini", Body.KETU, "Ashwini Kumaras"),
    BHARANI("Bharani", Body.VENUS, "Yama"),
    KRITTIKA("Krittika", Body.SUN, "Agni"),
    ROHINI("Rohini", Body.MOON, "Brahma"),
    MRIGASHIRA("Mrigashira", Body.MARS, "Soma"),
    ARDRA("Ardra", Body.RAHU, "Rudra"),
    PUNARVASU("Punarvasu", Body.JUPITER, "Aditi"),
    PUSHYA("Pushya", Body.SATURN, "Brihaspati"),
    ASHLESHA("Ashlesha", Body.MERCURY, "Sarpa"),
    MAGHA("Magha", Body.KETU, "Pitris"),
    PURVA_PHALGUNI("Purva Phalguni", Body.VENUS, "Bhaga"),
    UTTARA_PHALGUNI("Uttara Phalguni", Body.SUN, "Aryaman"),
    HASTA("Hasta", Body.MOON, "Savitar"),
    CHITRA("Chitra", Body.MARS, "Tvashtar"),
    SWATI("Swati", Body.RAHU, "Vayu"),
    VISHAKHA("Vishakha", Body.JUPITER, "Indra-Agni"),
    ANURADHA("Anuradha", Body.SATURN, "Mitra"),
    JYESHTHA("Jyeshtha", Body.MERCURY, "Indra"),
    MULA("Mula", Body.KETU, "Nirriti"),
    PURVA_ASHADHA("Purva Ashadha", Body.VENUS, "Apas"),
    UTTARA_ASHADHA("Uttara Ashadha", Body.SUN, "Vishve Devas"),
    SHRAVANA("Shravana", Body.MOON, "Vishnu"),
    DHANISHTA("Dhanishta", Body.MARS, "Vasus"),
    SHATABHISHA("Shatabhisha", Body.RAHU, "Varuna"),
    PURVA_BHADRAPADA("Purva Bhadrapada", Body.JUPITER, "Aja Ekapada"),
    UTTARA_BHADRAPADA("Uttara Bhadrapada", Body.SATURN, "Ahir Budhnya"),
    REVATI("Revati", Body.MERCURY, "Pushan");

    public static final int COUNT = 27;
    public static final int PADAS = 4;
    public static final double SPAN = 360.0 / COUNT;
    public static final double PADA_SPAN = 360.0 / (COUNT * PADAS);

    private static final Nakshatra[] NAKSHATRAS = values();

    private final String displayName;
    private final Body lord;
    private final String deity;

    Nakshatra(String displayName, Body lord, String deity) {
        this.displayName = displayName;
        this.lord = lord;
        this.deity = deity;
    }

    public static Nakshatra fromIndex(int index) {
        return NAKSHATRAS[Math.floorMod(index, COUNT)];
    }

    public static Nakshatra fromLongitude(double longitude) {
        return NAKSHATRAS[indexOf(longitude)];
    }

    public static int indexOf(double longitude) {
        return Angles.sectorIndex(longitude, SPAN, COUNT);
    }

    /**
     * Position within the nakshatra, [0, 13°20').
     */
    public static double degreeInNakshatra(double longitude) {
        return Angles.modulo(longitude, SPAN);
    }

    /**
     * Quarter of the nakshatra, 1 to 4.
     */
    public static int padaOf(double longitude) {
        int pada = (int) Math.floor(degreeInNakshatra(longitude) / PADA_SPAN) + 1;
        // guards the rounding case where degreeInNakshatra is a hair below SPAN
        return Math.min(pada, PADAS);
    }

    public int getIndex() {
        return ordinal();
    }

    public double getStartLongitude() {
        return ordinal() * SPAN;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Body getLord() {
        return lord;
    }

    /**
     * Presiding deity, as named in the classical tables.
     */
    public String getDeity() {
        return deity;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
