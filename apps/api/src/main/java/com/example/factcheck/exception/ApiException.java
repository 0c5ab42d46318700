package com.example.factcheck.exception;

import org.springframework.http.HttpStatusCode;

/**
 * Failure talking to a downstream service.
 */
public class ApiException extends RuntimeException {

    private final String serviceName;
    private final HttpStatusCode statusCode;

    public ApiException(String serviceName, HttpStatusCode statusCode, String message) {
        super(message);
        this.serviceName = serviceName;
        this.statusCode = statusCode;
    }

    public ApiException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
        this.statusCode = null;
    }

    public String getServiceName() {
        return serviceName;
    }

    public HttpStatusCode getStatusCode() {
        return statusCode;
    }

    @Override
    public String toString() {
        return "ApiException{" +
                "serviceName='" + serviceName + '\'' +
                ", statusCode=" + statusCode +
                ", message='" + getMessage() + '\'' +
                '}';
    }
}
