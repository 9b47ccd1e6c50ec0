package com.myorg.bjf.forwarding;

import com.myorg.bjf.forwarding.gateway.UpstreamResponse;

/**
 * What the caller of an {@link EventForwarder} entry point gets back.
 *
 * @param response the upstream response (append or create response for job writes)
 * @param outcome  how the write was delivered
 * @param jobId    bulk job the record went into, {@code null} for {@link WriteOutcome#DIRECT}
 */
public record ForwardResult(UpstreamResponse response, WriteOutcome outcome, String jobId) {

    public static ForwardResult direct(UpstreamResponse response) {
        return new ForwardResult(response, WriteOutcome.DIRECT, null);
    }
}
