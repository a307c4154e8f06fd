package in.co.kundli.astro;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.co.kundli.services.ChartServiceConfig;
import in.co.kundli.services.LoggingService;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Reads the orbital-element table and builds a {@link KeplerianEphemeris}.
 * The table comes from the configured file path when one is set, otherwise from the bundled classpath resource.
 */
public class EphemerisDataLoader implements Callable<EphemerisProvider> {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final String path;

    public EphemerisDataLoader() {
        this(ChartServiceConfig.getEphemerisPath());
    }

    /**
     * @param path data file on disk, or null for the bundled resource
     */
    public EphemerisDataLoader(String path) {
        this.path = path;
    }

    @Override
    public EphemerisProvider call() {
        String source = path != null ? path : "classpath:" + ChartServiceConfig.EPHEMERIS_CLASSPATH_RESOURCE;
        long startTime = LoggingService.logOperationStart("ephemeris_load", LoggingService.data("source", source));
        try {
            JsonNode root = path != null ? readFile(Paths.get(path)) : readResource();
            KeplerianEphemeris ephemeris = KeplerianEphemeris.fromJson(root);
            LoggingService.logOperationEnd("ephemeris_load", startTime,
                    LoggingService.data("source", source, "dataSource", root.path("source").asText("unknown")));
            return ephemeris;
        } catch (IOException | IllegalArgumentException e) {
            LoggingService.logOperationFailed("ephemeris_load", startTime, e);
            throw new EphemerisUnavailableException("Could not load ephemeris data from " + source + ": " + e.getMessage(), e);
        }
    }

    private JsonNode readFile(Path file) throws IOException {
        if (!Files.isReadable(file)) {
            throw new IOException("File is missing or unreadable");
        }
        try (InputStream in = Files.newInputStream(file)) {
            return objectMapper.readTree(in);
        }
    }

    private JsonNode readResource() throws IOException {
        ClassLoader classLoader = EphemerisDataLoader.class.getClassLoader();
        try (InputStream in = classLoader.getResourceAsStream(ChartServiceConfig.EPHEMERIS_CLASSPATH_RESOURCE)) {
            if (in == null) {
                throw new IOException("Resource not found");
            }
            return objectMapper.readTree(in);
        }
    }
}
