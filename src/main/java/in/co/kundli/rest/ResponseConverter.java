package in.co.kundli.rest;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Converts handler JSON string responses into ApiResponse objects with HTTP status codes.
 *
 * Handlers always answer with a JSON string carrying success:true/false; this class picks
 * the status from {@code errorCode} when the call failed.
 */
public class ResponseConverter {

    public static ApiResponse fromHandlerResponse(String handlerResult) {
        if (handlerResult == null) {
            return ApiResponse.errorMessage("No response from handler");
        }

        JsonObject json;
        try {
            json = JsonParser.parseString(handlerResult).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            // Not a JSON object, pass it through as-is
            return ApiResponse.ok(handlerResult);
        }

        if (json.has("success") && !json.get("success").getAsBoolean()) {
            return determineErrorStatus(json, handlerResult);
        }
        // success:true, or no success field at all
        return ApiResponse.ok(handlerResult);
    }

    private static ApiResponse determineErrorStatus(JsonObject json, String rawJson) {
        if (json.has("errorCode")) {
            switch (json.get("errorCode").getAsString()) {
                case "VALIDATION_ERROR":
                    return ApiResponse.unprocessable(rawJson);
                case "EPHEMERIS_UNAVAILABLE":
                    return ApiResponse.serviceUnavailable(rawJson);
                case "NOT_FOUND":
                    return ApiResponse.notFound(rawJson);
                case "INTERNAL_ERROR":
                    return ApiResponse.error(rawJson);
                default:
                    break;
            }
        }

        String errorMessage = json.has("errorMessage") ? json.get("errorMessage").getAsString().toLowerCase() : "";
        if (errorMessage.contains("unknown action") || errorMessage.contains("not found")) {
            return ApiResponse.notFound(rawJson);
        }

        // Default: 400 Bad Request for generic failures
        return ApiResponse.badRequest(rawJson);
    }
}
