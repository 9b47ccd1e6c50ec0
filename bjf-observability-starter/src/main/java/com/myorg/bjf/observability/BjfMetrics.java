package com.myorg.bjf.observability;

import com.myorg.bjf.forwarding.WriteOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class BjfMetrics {

    static final String FORWARD_SUCCESS = "bjf.forward.success";
    static final String FORWARD_FAIL = "bjf.forward.fail";
    static final String JOB_CREATED = "bjf.job.created";
    static final String JOB_APPENDED = "bjf.job.appended";
    static final String JOB_RECREATED = "bjf.job.recreated";
    static final String FORWARD_PROCESSING = "bjf.forward.processing";

    private final MeterRegistry registry;
    private final String serviceName;
    private final BjfObservabilityProperties props;

    // Pre-created base meters (so actuator never 404)
    private Counter cSuccess;
    private Counter cFail;
    private Counter cJobCreated;
    private Counter cJobAppended;
    private Counter cJobRecreated;

    /** Call once on startup. */
    public void preRegisterBaseMeters() {
        cSuccess      = Counter.builder(FORWARD_SUCCESS).tag("service", serviceName).register(registry);
        cFail         = Counter.builder(FORWARD_FAIL).tag("service", serviceName).register(registry);
        cJobCreated   = Counter.builder(JOB_CREATED).tag("service", serviceName).register(registry);
        cJobAppended  = Counter.builder(JOB_APPENDED).tag("service", serviceName).register(registry);
        cJobRecreated = Counter.builder(JOB_RECREATED).tag("service", serviceName).register(registry);

        Timer.builder(FORWARD_PROCESSING).tag("service", serviceName).register(registry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample, String operation, String outcome) {
        if (sample == null) return;

        Timer.Builder b = Timer.builder(FORWARD_PROCESSING)
                .tag("service", serviceName);

        if (props.isTagOperation() && operation != null) b.tag("operation", operation);
        if (props.isTagOutcome() && outcome != null) b.tag("outcome", outcome);

        sample.stop(b.register(registry));
    }

    public void incSuccess() { if (cSuccess != null) cSuccess.increment(); }
    public void incFail()    { if (cFail != null) cFail.increment(); }

    /**
     * Job counters for a delivered write. A recreated job also counts as created: a new
     * upstream job was opened either way.
     */
    public void recordOutcome(WriteOutcome outcome) {
        if (outcome == null) return;
        switch (outcome) {
            case CREATED -> inc(cJobCreated);
            case APPENDED -> inc(cJobAppended);
            case RECREATED -> {
                inc(cJobCreated);
                inc(cJobRecreated);
            }
            default -> { }
        }
    }

    private static void inc(Counter c) {
        if (c != null) c.increment();
    }
}
