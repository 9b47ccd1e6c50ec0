package com.myorg.bjf.forwarding.gateway;

import java.time.Instant;

/**
 * A bulk job opened by the upstream.
 *
 * @param id        job id to append further records to
 * @param closingAt when the upstream stops accepting appends, {@code null} if it did not say
 * @param response  the create response, returned to the caller as-is
 */
public record CreatedJob(String id, Instant closingAt, UpstreamResponse response) {}
