package com.myorg.bjf.forwarding;

/**
 * How a forwarded write reached the upstream.
 */
public enum WriteOutcome {
    /** appended to the job already recorded for the key */
    APPENDED("appended"),
    /** no live job: a new one was opened */
    CREATED("created"),
    /** append to the recorded job failed, a new job was opened instead */
    RECREATED("recreated"),
    /** plain request, no bulk job involved */
    DIRECT("direct");

    private final String tag;

    WriteOutcome(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
