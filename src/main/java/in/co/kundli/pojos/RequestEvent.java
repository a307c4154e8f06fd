package in.co.kundli.pojos;

import java.util.Map;

/**
 * Lambda Function URL event, plus the EventBridge fields used by warm-up pings.
 */
public class RequestEvent {
    private RequestContext requestContext;
    private String source;
    private String body;
    private Map<String, String> headers;
    private String detailType; // For EventBridge scheduled events

    public RequestEvent() {
    }

    public RequestContext getRequestContext() {
        return this.requestContext;
    }

    public void setRequestContext(RequestContext requestContext) {
        this.requestContext = requestContext;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public void setHeaders(Map<String, String> headers) {
        this.headers = headers;
    }

    public String getDetailType() {
        return detailType;
    }

    public void setDetailType(String detailType) {
        this.detailType = detailType;
    }

    /**
     * HTTP method and path of a Function URL call, or null for non-HTTP events.
     */
    public RequestContextHttp getHttp() {
        return requestContext == null ? null : requestContext.getHttp();
    }

    public String getHeader(String name) {
        if (headers == null || name == null) {
            return null;
        }
        // Function URLs lower-case header names, test events may not
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (name.equalsIgnoreCase(header.getKey())) {
                return header.getValue();
            }
        }
        return null;
    }
}
