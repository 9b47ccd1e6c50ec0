package com.myorg.bjf.forwarding.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.myorg.bjf.contracts.core.exception.ForwardingReason;
import com.myorg.bjf.forwarding.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;

/**
 * JSON-over-HTTP gateway. The {@link RestTemplate} is expected to carry the upstream base URL
 * (root URI) and timeouts; this class adds auth and content headers per request.
 */
@Slf4j
public class RestTemplateUpstreamGateway implements UpstreamGateway {

    // closing_at above this is taken as epoch millis rather than seconds
    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    private final RestTemplate rest;
    private final ObjectMapper mapper;
    private final String authorization;
    private final String userAgent;

    public RestTemplateUpstreamGateway(RestTemplate rest, ObjectMapper mapper, String authorization, String userAgent) {
        this.rest = rest;
        this.mapper = mapper;
        this.authorization = authorization;
        this.userAgent = userAgent;
    }

    @Override
    public UpstreamResponse send(String endpoint, ObjectNode body) {
        return post(endpoint, body, ForwardingReason.UPSTREAM_REQUEST_FAILURE);
    }

    @Override
    public UpstreamResponse append(String endpoint, String jobId, ObjectNode payload) {
        ObjectNode body = payload.deepCopy();
        body.putObject("job").put("id", jobId);
        return post(endpoint, body, ForwardingReason.UPSTREAM_APPEND_FAILURE);
    }

    @Override
    public CreatedJob create(String endpoint, ObjectNode payload) {
        UpstreamResponse res = post(endpoint, payload, ForwardingReason.UPSTREAM_CREATE_FAILURE);
        JsonNode body = res.body();
        String id = body == null ? null : body.path("id").asText(null);
        return new CreatedJob(id, closingAt(body), res);
    }

    private UpstreamResponse post(String endpoint, ObjectNode body, ForwardingReason reason) {
        try {
            ResponseEntity<String> res = rest.exchange(endpoint, HttpMethod.POST, new HttpEntity<>(body, headers()), String.class);
            return new UpstreamResponse(res.getStatusCode().value(), parse(res.getBody()));
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String msg = status == 401 ? "Unauthorized" : "Upstream " + endpoint + " returned " + status;
            throw new UpstreamException(reason, status, msg, e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            throw new UpstreamException(reason, 0, "Upstream " + endpoint + " unreachable: " + e.getMessage(), null, e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        h.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (StringUtils.hasText(authorization)) h.set(HttpHeaders.AUTHORIZATION, authorization);
        if (StringUtils.hasText(userAgent)) h.set(HttpHeaders.USER_AGENT, userAgent);
        return h;
    }

    private JsonNode parse(String raw) {
        if (!StringUtils.hasText(raw)) return null;
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Upstream returned a non-JSON body ({} chars)", raw.length());
            return TextNode.valueOf(raw);
        }
    }

    static Instant closingAt(JsonNode body) {
        if (body == null) return null;
        JsonNode v = body.get("closing_at");
        if (v == null || !v.canConvertToLong()) return null;
        long n = v.asLong();
        if (n <= 0) return null;
        return n > MILLIS_THRESHOLD ? Instant.ofEpochMilli(n) : Instant.ofEpochSecond(n);
    }
}
