package com.myorg.bjf.forwarding.exception;

import com.myorg.bjf.contracts.core.exception.ForwardingException;
import com.myorg.bjf.contracts.core.exception.ForwardingReason;

// Never surfaced to callers: the coordinator logs it and coalescing degrades.
public class DirectoryWriteException extends ForwardingException {
    public DirectoryWriteException(String jobKey, Throwable cause) {
        super(ForwardingReason.DIRECTORY_WRITE_FAILURE, "Job directory write failed for jobKey=" + jobKey, cause);
    }
}
