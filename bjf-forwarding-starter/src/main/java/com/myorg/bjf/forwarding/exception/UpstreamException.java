package com.myorg.bjf.forwarding.exception;

import com.myorg.bjf.contracts.core.exception.ForwardingException;
import com.myorg.bjf.contracts.core.exception.ForwardingReason;

/**
 * Non-success outcome of an upstream call: a non-2xx response, or an I/O failure
 * ({@link #getStatus()} is {@code 0} then).
 */
public class UpstreamException extends ForwardingException {

    private final int status;
    private final String responseBody;

    public UpstreamException(ForwardingReason reason, int status, String message, String responseBody, Throwable cause) {
        super(reason, message, cause);
        this.status = status;
        this.responseBody = responseBody;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
