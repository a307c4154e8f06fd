package in.co.kundli.pojos;

public class RequestContext {
    private String requestId;
    private RequestContextHttp http;

    public RequestContext() {
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public RequestContextHttp getHttp() {
        return http;
    }

    public void setHttp(RequestContextHttp http) {
        this.http = http;
    }
}
