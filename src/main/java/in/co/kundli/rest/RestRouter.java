package in.co.kundli.rest;

import in.co.kundli.handlers.ChartHandler;
import in.co.kundli.handlers.SystemHandler;
import in.co.kundli.pojos.BirthChartRequest;
import in.co.kundli.services.ChartServiceConfig;
import in.co.kundli.services.LoggingService;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * REST router that maps HTTP method + path to handler actions.
 */
public class RestRouter {

    private final List<Route> routes = new ArrayList<>();

    private final ChartHandler chartHandler;
    private final SystemHandler systemHandler;

    public RestRouter(ChartHandler chartHandler, SystemHandler systemHandler) {
        this.chartHandler = chartHandler;
        this.systemHandler = systemHandler;

        registerRoutes();
    }

    /**
     * Attempt to route a request. Returns null if no route matches.
     */
    public ApiResponse route(String method, String path, BirthChartRequest body) {
        if (body == null) {
            body = new BirthChartRequest();
        }

        for (Route route : routes) {
            if (!route.method.equalsIgnoreCase(method)) continue;

            if (!route.pattern.matcher(path).matches()) continue;

            LoggingService.setFunction(route.functionName);

            try {
                ApiResponse response = route.handler.handle(body);
                if (response == null) {
                    return ApiResponse.errorMessage("No response from handler");
                }
                return response;
            } catch (Exception e) {
                LoggingService.error("rest_handler_exception", e);
                return ApiResponse.errorMessage(e.getMessage() != null ? e.getMessage() : "Internal server error");
            }
        }

        return null; // No matching route
    }

    /**
     * Check if a path starts with our REST prefix.
     */
    public static boolean isRestPath(String path) {
        return path != null && (path.startsWith(ChartServiceConfig.API_PREFIX) || path.equals("/api/v1"));
    }

    // ============= Route Registration =============

    private void registerRoutes() {
        // --- Charts ---
        post("/api/v1/planets", "get_birth_chart", body -> {
            String result = chartHandler.handleRequest("get_birth_chart", body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        // --- System ---
        get("/api/v1/health", "health", body -> {
            String result = systemHandler.handleRequest("health");
            return ResponseConverter.fromHandlerResponse(result);
        });

        get("/api/v1/?", "service_info", body -> {
            String result = systemHandler.handleRequest("service_info");
            return ResponseConverter.fromHandlerResponse(result);
        });
    }

    // ============= Route Helpers =============

    private void get(String pathPattern, String functionName, RouteHandler handler) {
        routes.add(new Route("GET", pathPattern, functionName, handler));
    }

    private void post(String pathPattern, String functionName, RouteHandler handler) {
        routes.add(new Route("POST", pathPattern, functionName, handler));
    }

    // ============= Route Model =============

    @FunctionalInterface
    interface RouteHandler {
        ApiResponse handle(BirthChartRequest body) throws Exception;
    }

    static class Route {
        final String method;
        final Pattern pattern;
        final String functionName;
        final RouteHandler handler;

        Route(String method, String pathPattern, String functionName, RouteHandler handler) {
            this.method = method;
            this.functionName = functionName;
            this.handler = handler;
            this.pattern = Pattern.compile("^" + pathPattern + "$");
        }
    }
}
