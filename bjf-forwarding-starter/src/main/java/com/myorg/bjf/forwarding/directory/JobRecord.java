package com.myorg.bjf.forwarding.directory;

import java.time.Instant;

/**
 * The open upstream job for one job key.
 *
 * @param jobId     upstream job id
 * @param expiresAt after this instant the record counts as absent
 */
public record JobRecord(String jobId, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
