package com.myorg.bjf.forwarding;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.bjf.contracts.events.AnalyticsEvent;
import com.myorg.bjf.contracts.events.EventAction;
import com.myorg.bjf.forwarding.context.ForwardingContext;
import com.myorg.bjf.forwarding.context.ForwardingMdc;
import com.myorg.bjf.forwarding.coordinator.JobCoordinator;
import com.myorg.bjf.forwarding.exception.ConfigurationInvalidException;
import com.myorg.bjf.forwarding.gateway.UpstreamGateway;
import com.myorg.bjf.forwarding.mapping.PayloadMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Validation, MDC and the hop onto the forwarding executor, shared by both strategies.
 * Subclasses only decide which upstream calls an event turns into.
 */
@Slf4j
public abstract class AbstractEventForwarder implements EventForwarder {

    protected static final String USERS_ENDPOINT = "/users";

    protected final ForwardingValidator validator;
    protected final ForwardingKeys keys;
    protected final PayloadMapper mapper;
    protected final UpstreamGateway gateway;
    protected final JobCoordinator coordinator;
    private final Executor executor;

    protected AbstractEventForwarder(ForwardingValidator validator,
                                     ForwardingKeys keys,
                                     PayloadMapper mapper,
                                     UpstreamGateway gateway,
                                     JobCoordinator coordinator,
                                     Executor executor) {
        this.validator = validator;
        this.keys = keys;
        this.mapper = mapper;
        this.gateway = gateway;
        this.coordinator = coordinator;
        this.executor = executor;
    }

    /**
     * Validate {@code event} on the caller thread, then run {@code work} with the user key on
     * the forwarding executor. Validation failures complete the future without touching the
     * lock or the upstream.
     */
    protected CompletableFuture<ForwardResult> submit(EventAction action,
                                                      AnalyticsEvent event,
                                                      Function<String, ForwardResult> work) {
        String userKey;
        try {
            userKey = validator.validate(event);
        } catch (ConfigurationInvalidException e) {
            log.warn("Rejected {} messageId={}: {}", action.code(),
                    event == null ? null : event.getMessageId(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        ForwardingContext ctx = new ForwardingContext(keys.tenant(), userKey, action.code(), event.getMessageId());
        return CompletableFuture.supplyAsync(() -> {
            ForwardingMdc.put(ctx);
            try {
                return work.apply(userKey);
            } finally {
                ForwardingMdc.clear();
            }
        }, executor);
    }

    // plain user upsert, ordered with the user's track writes through the shared lock key
    protected ForwardResult upsertUser(String userKey, ObjectNode body) {
        return coordinator.exclusive(keys.lockKey(userKey), () -> gateway.send(USERS_ENDPOINT, body));
    }
}
