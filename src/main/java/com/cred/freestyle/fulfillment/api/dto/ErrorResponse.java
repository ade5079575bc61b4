package com.cred.freestyle.fulfillment.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error body returned by every endpoint, webhooks included.
 *
 * Payment providers only look at the status code: a 5xx makes them redeliver, a 4xx does not.
 * {@code retryable} spells that out for support staff reading provider delivery logs, and
 * {@code provider} names the provider whose webhook was rejected.
 *
 * @author Fulfillment Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private final Instant timestamp;
    private final int status;
    private final String error;
    private final String message;
    private final String path;
    private final boolean retryable;
    private String provider;
    private final Map<String, Object> details = new LinkedHashMap<>();

    public ErrorResponse(HttpStatus status, String error, String message, String path) {
        this.timestamp = Instant.now();
        this.status = status.value();
        this.error = error;
        this.message = message;
        this.path = path;
        this.retryable = status.is5xxServerError();
    }

    /**
     * Name the payment provider the failed request came from.
     *
     * @param provider Provider key
     * @return This ErrorResponse for method chaining
     */
    public ErrorResponse forProvider(String provider) {
        this.provider = provider;
        return this;
    }

    public ErrorResponse addDetail(String key, Object value) {
        this.details.put(key, value);
        return this;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public int getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    public String getPath() {
        return path;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public String getProvider() {
        return provider;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getDetails() {
        return details;
    }
}
