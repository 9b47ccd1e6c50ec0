package com.myorg.bjf.forwarding;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.bjf.contracts.core.exception.ForwardingReason;
import com.myorg.bjf.forwarding.exception.UpstreamException;
import com.myorg.bjf.forwarding.gateway.CreatedJob;
import com.myorg.bjf.forwarding.gateway.UpstreamGateway;
import com.myorg.bjf.forwarding.gateway.UpstreamResponse;

import java.time.Instant;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-process upstream: records every call in order, hands out scripted job ids, and fails
 * on demand. Tracks how many calls overlap so tests can check mutual exclusion.
 */
public class RecordingGateway implements UpstreamGateway {

    public record Call(String kind, String endpoint, String jobId, ObjectNode body) {}

    public final List<Call> calls = new CopyOnWriteArrayList<>();
    public final Queue<String> jobIds = new ConcurrentLinkedQueue<>();

    public volatile Supplier<Instant> closingAt = () -> Instant.now().plusSeconds(900);
    public volatile int failAppendStatus;
    public volatile int failCreateStatus;
    public volatile int failSendStatus;
    public volatile String failSendEndpoint;
    public volatile long latencyMs;

    private final AtomicInteger generated = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();

    @Override
    public UpstreamResponse send(String endpoint, ObjectNode body) {
        return call(new Call("send", endpoint, null, body), () -> {
            if (failSendStatus > 0 && (failSendEndpoint == null || failSendEndpoint.equals(endpoint))) {
                throw new UpstreamException(ForwardingReason.UPSTREAM_REQUEST_FAILURE, failSendStatus,
                        "send failed", null, null);
            }
            return ok(JsonNodeFactory.instance.objectNode().put("type", "record"));
        });
    }

    @Override
    public UpstreamResponse append(String endpoint, String jobId, ObjectNode payload) {
        return call(new Call("append", endpoint, jobId, payload), () -> {
            if (failAppendStatus > 0) {
                throw new UpstreamException(ForwardingReason.UPSTREAM_APPEND_FAILURE, failAppendStatus,
                        "append failed", null, null);
            }
            return ok(JsonNodeFactory.instance.objectNode().put("id", jobId));
        });
    }

    @Override
    public CreatedJob create(String endpoint, ObjectNode payload) {
        Call c = new Call("create", endpoint, null, payload);
        return call(c, () -> {
            if (failCreateStatus > 0) {
                throw new UpstreamException(ForwardingReason.UPSTREAM_CREATE_FAILURE, failCreateStatus,
                        "create failed", null, null);
            }
            String id = jobIds.poll();
            if (id == null) id = "job-" + generated.incrementAndGet();
            Instant closing = closingAt.get();
            ObjectNode body = JsonNodeFactory.instance.objectNode().put("id", id);
            if (closing != null) body.put("closing_at", closing.getEpochSecond());
            return new CreatedJob(id, closing, ok(body));
        });
    }

    public long count(String kind) {
        return calls.stream().filter(c -> c.kind().equals(kind)).count();
    }

    public List<String> kinds() {
        return calls.stream().map(Call::kind).toList();
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    private <T> T call(Call c, Supplier<T> body) {
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            if (latencyMs > 0) {
                try {
                    Thread.sleep(latencyMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            calls.add(c);
            return body.get();
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private static UpstreamResponse ok(ObjectNode body) {
        return new UpstreamResponse(200, body);
    }
}
