package com.myorg.bjf.forwarding.gateway;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Successful (2xx) upstream response.
 *
 * @param status HTTP status code
 * @param body   parsed JSON body, {@code null} when the upstream sent none
 */
public record UpstreamResponse(int status, JsonNode body) {}
