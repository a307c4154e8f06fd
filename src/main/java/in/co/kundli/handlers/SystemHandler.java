package in.co.kundli.handlers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import in.co.kundli.astro.EphemerisHolder;
import in.co.kundli.services.ChartServiceConfig;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health check and service description. Neither action touches the ephemeris loader.
 */
public class SystemHandler {

    private final EphemerisHolder ephemerisHolder;
    private final Gson gson;

    public SystemHandler(EphemerisHolder ephemerisHolder) {
        this.ephemerisHolder = ephemerisHolder;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public String handleRequest(String action) {
        return switch (action) {
            case "health" -> handleHealth();
            case "service_info" -> handleServiceInfo();
            default -> gson.toJson(Map.of("success", false, "errorMessage", "Unknown action: " + action));
        };
    }

    public static boolean handles(String functionName) {
        return functionName != null && (
            functionName.equals("health") ||
            functionName.equals("service_info")
        );
    }

    private String handleHealth() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("success", true);
        health.put("status", "ok");
        health.put("source", ChartServiceConfig.SERVICE_NAME);
        health.put("version", ChartServiceConfig.SERVICE_VERSION);
        health.put("ephemerisLoaded", ephemerisHolder.isLoaded());
        return gson.toJson(health);
    }

    private String handleServiceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("success", true);
        info.put("service", ChartServiceConfig.SERVICE_NAME);
        info.put("version", ChartServiceConfig.SERVICE_VERSION);
        info.put("endpoints", List.of(
                Map.of("method", "POST", "path", "/api/v1/planets", "description", "Sidereal birth chart"),
                Map.of("method", "GET", "path", "/api/v1/health", "description", "Liveness check")
        ));
        return gson.toJson(info);
    }
}
