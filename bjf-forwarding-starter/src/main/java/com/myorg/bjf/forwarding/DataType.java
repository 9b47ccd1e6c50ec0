package com.myorg.bjf.forwarding;

/**
 * Upstream data type a bulk job accepts; part of the job coalescing key.
 */
public enum DataType {
    USERS("users", "user"),
    EVENTS("events", "event");

    private final String code;
    private final String itemType;

    DataType(String code, String itemType) {
        this.code = code;
        this.itemType = itemType;
    }

    public String code() {
        return code;
    }

    /** {@code data_type} of a single bulk item. */
    public String itemType() {
        return itemType;
    }

    public String bulkEndpoint() {
        return "/bulk/" + code;
    }
}
