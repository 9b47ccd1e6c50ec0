package com.myorg.bjf.forwarding.gateway;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.bjf.forwarding.exception.UpstreamException;

/**
 * Outbound calls to the upstream service.
 *
 * <p>Every method either returns a successful response or throws {@link UpstreamException};
 * implementations never return a non-2xx response.
 */
public interface UpstreamGateway {

    /** Plain single-record write, e.g. {@code POST /users}. */
    UpstreamResponse send(String endpoint, ObjectNode body) throws UpstreamException;

    /** Add records to an open bulk job. Any failure (closed job, bad id, 5xx) is an {@link UpstreamException}. */
    UpstreamResponse append(String endpoint, String jobId, ObjectNode payload) throws UpstreamException;

    /** Open a new bulk job carrying {@code payload}. */
    CreatedJob create(String endpoint, ObjectNode payload) throws UpstreamException;
}
