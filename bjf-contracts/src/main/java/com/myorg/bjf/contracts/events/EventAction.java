package com.myorg.bjf.contracts.events;

public enum EventAction {
    IDENTIFY("identify"),
    TRACK("track"),
    GROUP("group");

    private final String code;

    EventAction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
