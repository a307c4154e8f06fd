package in.co.kundli.handlers;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import in.co.kundli.astro.EphemerisUnavailableException;
import in.co.kundli.pojos.BirthChartRequest;
import in.co.kundli.services.BirthChartService;
import in.co.kundli.services.ChartValidationException;
import in.co.kundli.services.LoggingService;

import java.util.Map;

/**
 * Handler for birth chart calculation.
 */
public class ChartHandler {

    public static final String ERROR_EPHEMERIS_UNAVAILABLE = "EPHEMERIS_UNAVAILABLE";

    private final BirthChartService birthChartService;
    private final Gson gson;

    public ChartHandler(BirthChartService birthChartService) {
        this.birthChartService = birthChartService;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public String handleRequest(String action, BirthChartRequest requestBody) {
        return switch (action) {
            case "get_birth_chart" -> handleGetBirthChart(requestBody);
            default -> gson.toJson(Map.of("success", false, "errorMessage", "Unknown action: " + action));
        };
    }

    /**
     * Check if a function name is handled by this handler.
     */
    public static boolean handles(String functionName) {
        return "get_birth_chart".equals(functionName);
    }

    // ============= Handler Methods =============

    private String handleGetBirthChart(BirthChartRequest requestBody) {
        try {
            return gson.toJson(birthChartService.getBirthChart(requestBody));
        } catch (ChartValidationException e) {
            LoggingService.warn("birth_chart_validation_failed", LoggingService.data("errors", e.getErrors()));
            return gson.toJson(Map.of(
                    "success", false,
                    "errorCode", ChartValidationException.ERROR_CODE,
                    "errorMessage", e.getMessage(),
                    "errors", e.getErrors()
            ));
        } catch (EphemerisUnavailableException e) {
            LoggingService.error("birth_chart_ephemeris_unavailable", e);
            return gson.toJson(Map.of(
                    "success", false,
                    "errorCode", ERROR_EPHEMERIS_UNAVAILABLE,
                    "errorMessage", "Planetary data is temporarily unavailable"
            ));
        }
    }
}
