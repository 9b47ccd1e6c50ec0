package com.myorg.bjf.forwarding;

import com.myorg.bjf.contracts.events.GroupEvent;
import com.myorg.bjf.contracts.events.IdentifyEvent;
import com.myorg.bjf.contracts.events.TrackEvent;

import java.util.concurrent.CompletableFuture;

/**
 * Caller-facing entry points. Each returned future completes with the upstream result, or
 * exceptionally with a {@link com.myorg.bjf.contracts.core.exception.ForwardingException}.
 */
public interface EventForwarder {

    CompletableFuture<ForwardResult> identify(IdentifyEvent event);

    CompletableFuture<ForwardResult> track(TrackEvent event);

    CompletableFuture<ForwardResult> group(GroupEvent event);

    ForwardingMode mode();
}
