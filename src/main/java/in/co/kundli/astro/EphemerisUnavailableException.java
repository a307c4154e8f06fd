package in.co.kundli.astro;

/**
 * The ephemeris data could not be loaded, so no chart can be calculated.
 */
public class EphemerisUnavailableException extends RuntimeException {

    public EphemerisUnavailableException(String message) {
        super(message);
    }

    public EphemerisUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
