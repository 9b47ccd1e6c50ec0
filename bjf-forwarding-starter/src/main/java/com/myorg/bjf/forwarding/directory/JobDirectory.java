package com.myorg.bjf.forwarding.directory;

import com.myorg.bjf.forwarding.exception.DirectoryReadException;
import com.myorg.bjf.forwarding.exception.DirectoryWriteException;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared mapping from a job key ({@code tenant:jobs:dataType:userKey}) to the upstream job
 * currently open for it.
 *
 * <p>Callers mutate an entry only while holding the lock for the corresponding user; the
 * directory itself does no read-modify-write.
 */
public interface JobDirectory {

    /**
     * @return the live record, or empty if there is none or it has expired
     * @throws DirectoryReadException if the backing store cannot be read
     */
    Optional<JobRecord> lookup(String jobKey) throws DirectoryReadException;

    /**
     * Unconditionally overwrite the record for {@code jobKey} with {@code jobId}, expiring
     * {@code ttl} from now. Never a create-if-absent write: a fresh job replaces a stale one
     * even before the stale one's TTL elapses.
     *
     * @throws DirectoryWriteException if the backing store cannot be written
     */
    void record(String jobKey, String jobId, Duration ttl) throws DirectoryWriteException;

    /** Remove the record, if any. */
    void clear(String jobKey) throws DirectoryWriteException;
}
