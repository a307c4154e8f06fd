package in.co.kundli;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import in.co.kundli.astro.EphemerisHolder;
import in.co.kundli.handlers.ChartHandler;
import in.co.kundli.handlers.SystemHandler;
import in.co.kundli.pojos.BirthChartRequest;
import in.co.kundli.pojos.RequestContextHttp;
import in.co.kundli.pojos.RequestEvent;
import in.co.kundli.rest.ApiResponse;
import in.co.kundli.rest.RestRouter;
import in.co.kundli.services.BirthChartService;
import in.co.kundli.services.ChartRequestValidator;
import in.co.kundli.services.LoggingService;

import java.util.Map;

/**
 * Lambda entry point. Function URL calls under /api/v1/ go through the REST router; other bodies are
 * dispatched on their {@code function} field. EventBridge pings only warm the container.
 */
public class Handler implements RequestHandler<RequestEvent, Object> {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final ChartHandler chartHandler;
    private final SystemHandler systemHandler;
    private final RestRouter restRouter;

    public Handler() {
        this(EphemerisHolder.getDefault());
    }

    public Handler(EphemerisHolder ephemerisHolder) {
        // cold start: load planetary data now, a failure surfaces on the first chart request
        ephemerisHolder.preload();
        this.chartHandler = new ChartHandler(new BirthChartService(ephemerisHolder, new ChartRequestValidator()));
        this.systemHandler = new SystemHandler(ephemerisHolder);
        this.restRouter = new RestRouter(chartHandler, systemHandler);
    }

    @Override
    public Object handleRequest(RequestEvent event, Context context) {
        LoggingService.initRequest(context);
        try {
            if ("aws.events".equals(event.getSource())) {
                LoggingService.info("warmed_up");
                return "Warmed up!";
            }
            LoggingService.setCorrelationId(event.getHeader("x-request-id"));

            RequestContextHttp http = event.getHttp();
            if (http != null && RestRouter.isRestPath(http.getPath())) {
                return handleRest(http, event.getBody()).toLambdaResponse();
            }
            return handleFunction(event.getBody());
        } catch (Exception e) {
            LoggingService.error("handler_exception", e);
            return gson.toJson(Map.of("success", false, "errorMessage",
                    e.getMessage() != null ? e.getMessage() : "Internal server error"));
        } finally {
            LoggingService.clearContext();
        }
    }

    private ApiResponse handleRest(RequestContextHttp http, String rawBody) {
        BirthChartRequest requestBody;
        try {
            requestBody = parseBody(rawBody);
        } catch (JsonParseException e) {
            LoggingService.warn("request_body_malformed", LoggingService.data("path", http.getPath()));
            return ApiResponse.unprocessableMessage("Malformed JSON body: " + e.getMessage());
        }
        ApiResponse response = restRouter.route(http.getMethod(), http.getPath(), requestBody);
        if (response == null) {
            LoggingService.warn("rest_route_not_found", LoggingService.data("method", http.getMethod(), "path", http.getPath()));
            return ApiResponse.notFoundMessage("No route for " + http.getMethod() + " " + http.getPath());
        }
        return response;
    }

    private String handleFunction(String rawBody) {
        BirthChartRequest requestBody;
        try {
            requestBody = parseBody(rawBody);
        } catch (JsonParseException e) {
            return gson.toJson(Map.of("success", false, "errorCode", "VALIDATION_ERROR",
                    "errorMessage", "Malformed JSON body: " + e.getMessage()));
        }
        String function = requestBody.getFunction();
        LoggingService.setFunction(function);

        if (ChartHandler.handles(function)) {
            return chartHandler.handleRequest(function, requestBody);
        }
        if (SystemHandler.handles(function)) {
            return systemHandler.handleRequest(function);
        }
        LoggingService.warn("unknown_function", LoggingService.data("function", String.valueOf(function)));
        return gson.toJson(Map.of("success", false, "errorMessage", "Unknown function: " + function));
    }

    /**
     * Empty bodies (GET requests) parse to an empty request.
     */
    private BirthChartRequest parseBody(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return new BirthChartRequest();
        }
        BirthChartRequest requestBody = gson.fromJson(rawBody, BirthChartRequest.class);
        return requestBody != null ? requestBody : new BirthChartRequest();
    }
}
