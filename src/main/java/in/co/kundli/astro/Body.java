package in.co.kundli.astro;

/**
 * Bodies placed in a chart, in output order. The two lunar nodes are shadow points, not ephemeris bodies.
 */
public enum Body {
    SUN("Sun", false),
    MOON("Moon", false),
    MARS("Mars", false),
    MERCURY("Mercury", false),
    JUPITER("Jupiter", false),
    VENUS("Venus", false),
    SATURN("Saturn", false),
    RAHU("Rahu", true),
    KETU("Ketu", true);

    private final String displayName;
    private final boolean lunarNode;

    Body(String displayName, boolean lunarNode) {
        this.displayName = displayName;
        this.lunarNode = lunarNode;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isLunarNode() {
        return lunarNode;
    }

    /**
     * Bodies whose positions come from the ephemeris.
     */
    public static Body[] ephemerisBodies() {
        return new Body[]{SUN, MOON, MARS, MERCURY, JUPITER, VENUS, SATURN};
    }

    @Override
    public String toString() {
        return displayName;
    }
}
