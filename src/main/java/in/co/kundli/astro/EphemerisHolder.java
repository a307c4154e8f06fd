package in.co.kundli.astro;

import in.co.kundli.services.LoggingService;

import java.util.concurrent.Callable;

/**
 * Process-wide ephemeris handle, loaded at most once.
 *
 * Concurrent first callers block on the same lock and share the single load. A failed load is not kept:
 * the next caller tries again and, if the data is still missing, gets the same {@link EphemerisUnavailableException}.
 */
public class EphemerisHolder {

    private static final EphemerisHolder DEFAULT = new EphemerisHolder(new EphemerisDataLoader());

    private final Callable<EphemerisProvider> loader;
    private volatile EphemerisProvider ephemeris;
    private final Object lock = new Object();

    public EphemerisHolder(Callable<EphemerisProvider> loader) {
        this.loader = loader;
    }

    public static EphemerisHolder getDefault() {
        return DEFAULT;
    }

    /**
     * @throws EphemerisUnavailableException if the data cannot be loaded
     */
    public EphemerisProvider get() {
        EphemerisProvider current = ephemeris;
        if (current == null) {
            synchronized (lock) {
                current = ephemeris;
                if (current == null) {
                    current = load();
                    ephemeris = current;
                }
            }
        }
        return current;
    }

    public boolean isLoaded() {
        return ephemeris != null;
    }

    /**
     * Warm the handle at cold start. Failures are logged and left for the first chart request to report.
     */
    public void preload() {
        try {
            get();
        } catch (EphemerisUnavailableException e) {
            LoggingService.error("ephemeris_preload_failed", e);
        }
    }

    private EphemerisProvider load() {
        try {
            EphemerisProvider loaded = loader.call();
            if (loaded == null) {
                throw new EphemerisUnavailableException("Ephemeris loader returned nothing");
            }
            return loaded;
        } catch (EphemerisUnavailableException e) {
            throw e;
        } catch (Exception e) {
            throw new EphemerisUnavailableException("Could not load ephemeris: " + e.getMessage(), e);
        }
    }
}
