package in.co.kundli.astro;

import java.util.Locale;

/**
 * Ayanamsha systems accepted on requests. Only Lahiri has its own formula; see {@link AyanamshaCalculator}.
 */
public enum Ayanamsha {
    LAHIRI("lahiri"),
    RAMAN("raman"),
    KRISHNAMURTI("krishnamurti"),
    THIRUKANITHAM("thirukanitham");

    private final String requestValue;

    Ayanamsha(String requestValue) {
        this.requestValue = requestValue;
    }

    public String getRequestValue() {
        return requestValue;
    }

    /**
     * Parse a request value, case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no known system
     */
    public static Ayanamsha fromRequestValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("ayanamsha must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Ayanamsha ayanamsha : values()) {
            if (ayanamsha.requestValue.equals(normalized)) {
                return ayanamsha;
            }
        }
        throw new IllegalArgumentException("Unsupported ayanamsha: " + value);
    }
}
