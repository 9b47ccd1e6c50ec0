package com.myorg.bjf.forwarding.exception;

import com.myorg.bjf.contracts.core.exception.ForwardingException;
import com.myorg.bjf.contracts.core.exception.ForwardingReason;

public class DirectoryReadException extends ForwardingException {
    public DirectoryReadException(String jobKey, Throwable cause) {
        super(ForwardingReason.DIRECTORY_READ_FAILURE, "Job directory lookup failed for jobKey=" + jobKey, cause);
    }
}
