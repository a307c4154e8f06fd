package in.co.kundli.services;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging for CloudWatch Logs Insights.
 *
 * Every line carries the Lambda request id and the action being served in the ThreadContext;
 * per-event key/values go into the {@code data} key as JSON.
 *
 * <pre>
 * -- Charts that fell back to Lahiri
 * fields @timestamp, requestId, data
 * | filter message = "ayanamsha_fallback_to_lahiri"
 *
 * -- Slow chart calculations
 * fields @timestamp, requestId, data
 * | filter message = "birth_chart_completed"
 * | sort @timestamp desc
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    // ThreadContext (MDC) keys
    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_CORRELATION_ID = "correlationId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_DATA = "data";

    /**
     * Reset the context and tag it with the Lambda request id. Call at the start of every invocation.
     */
    public static void initRequest(Context context) {
        clearContext();
        if (context != null) {
            ThreadContext.put(KEY_REQUEST_ID, context.getAwsRequestId());
        }
    }

    /**
     * Correlation id supplied by the caller (the x-request-id header).
     */
    public static void setCorrelationId(String correlationId) {
        if (correlationId != null) {
            ThreadContext.put(KEY_CORRELATION_ID, correlationId);
        }
    }

    public static void setFunction(String function) {
        if (function != null) {
            ThreadContext.put(KEY_FUNCTION, function);
        }
    }

    public static void clearContext() {
        ThreadContext.clearAll();
    }

    // =========================================================================
    // Logging Methods
    // =========================================================================

    public static void debug(String message) {
        logger.debug(message);
    }

    public static void debug(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.debug(message);
        clearDataContext();
    }

    public static void info(String message) {
        logger.info(message);
    }

    public static void info(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.info(message);
        clearDataContext();
    }

    public static void warn(String message) {
        logger.warn(message);
    }

    public static void warn(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message);
        clearDataContext();
    }

    public static void error(String message) {
        logger.error(message);
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void error(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message);
        clearDataContext();
    }

    public static void error(String message, Throwable t, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message, t);
        clearDataContext();
    }

    // =========================================================================
    // Operation timing
    // =========================================================================

    /**
     * Logs {@code <operation>_started} and returns the start time for {@link #logOperationEnd}.
     */
    public static long logOperationStart(String operation, Map<String, Object> data) {
        info(operation + "_started", data);
        return System.currentTimeMillis();
    }

    public static void logOperationEnd(String operation, long startTime, Map<String, Object> additionalData) {
        long duration = System.currentTimeMillis() - startTime;
        Map<String, Object> data = new HashMap<>(additionalData);
        data.put("durationMs", duration);
        info(operation + "_completed", data);
    }

    public static void logOperationFailed(String operation, long startTime, Throwable t) {
        long duration = System.currentTimeMillis() - startTime;
        error(operation + "_failed", t, Map.of("durationMs", duration));
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    private static void setDataContext(Map<String, Object> data) {
        if (data != null && !data.isEmpty()) {
            ThreadContext.put(KEY_DATA, gson.toJson(data));
        }
    }

    private static void clearDataContext() {
        ThreadContext.remove(KEY_DATA);
    }

    /**
     * Mutable map from alternating key/value arguments, for log data.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }
}
