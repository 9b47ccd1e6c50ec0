package com.myorg.bjf.observability;

import com.myorg.bjf.contracts.core.exception.ForwardingException;
import com.myorg.bjf.contracts.events.EventAction;
import com.myorg.bjf.contracts.events.GroupEvent;
import com.myorg.bjf.contracts.events.IdentifyEvent;
import com.myorg.bjf.contracts.events.TrackEvent;
import com.myorg.bjf.forwarding.EventForwarder;
import com.myorg.bjf.forwarding.ForwardResult;
import com.myorg.bjf.forwarding.ForwardingMode;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

@Slf4j
@RequiredArgsConstructor
public class ObservingEventForwarder implements EventForwarder {

    private final EventForwarder delegate;
    private final BjfObservabilityProperties props;
    private final BjfMetrics metrics; // can be null if metrics disabled

    @Override
    public CompletableFuture<ForwardResult> identify(IdentifyEvent event) {
        return observe(EventAction.IDENTIFY, () -> delegate.identify(event));
    }

    @Override
    public CompletableFuture<ForwardResult> track(TrackEvent event) {
        return observe(EventAction.TRACK, () -> delegate.track(event));
    }

    @Override
    public CompletableFuture<ForwardResult> group(GroupEvent event) {
        return observe(EventAction.GROUP, () -> delegate.group(event));
    }

    @Override
    public ForwardingMode mode() {
        return delegate.mode();
    }

    EventForwarder delegate() {
        return delegate;
    }

    private CompletableFuture<ForwardResult> observe(EventAction action, Supplier<CompletableFuture<ForwardResult>> call) {
        boolean on = metrics != null && props.isMetricsEnabled();
        if (!on) return call.get();

        Timer.Sample sample = metrics.startTimer();
        CompletableFuture<ForwardResult> f;
        try {
            f = call.get();
        } catch (RuntimeException e) {
            onFailure(sample, action, e);
            throw e;
        }

        return f.whenComplete((res, err) -> {
            if (err != null) {
                onFailure(sample, action, err);
                return;
            }
            metrics.incSuccess();
            if (res != null) metrics.recordOutcome(res.outcome());
            metrics.stopTimer(sample, action.code(), res == null ? "success" : res.outcome().tag());
        });
    }

    private void onFailure(Timer.Sample sample, EventAction action, Throwable err) {
        metrics.incFail();
        metrics.stopTimer(sample, action.code(), failureTag(err));
    }

    static String failureTag(Throwable err) {
        Throwable t = err;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof ForwardingException fe) {
            return fe.getReason().name().toLowerCase(Locale.ROOT);
        }
        return "fail";
    }
}
