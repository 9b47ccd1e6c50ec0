package com.myorg.bjf.forwarding.coordinator;

import com.myorg.bjf.forwarding.ForwardResult;
import com.myorg.bjf.forwarding.WriteOutcome;
import com.myorg.bjf.forwarding.directory.JobDirectory;
import com.myorg.bjf.forwarding.directory.JobRecord;
import com.myorg.bjf.forwarding.exception.DirectoryReadException;
import com.myorg.bjf.forwarding.exception.LockUnavailableException;
import com.myorg.bjf.forwarding.exception.UpstreamException;
import com.myorg.bjf.forwarding.gateway.CreatedJob;
import com.myorg.bjf.forwarding.gateway.UpstreamGateway;
import com.myorg.bjf.forwarding.gateway.UpstreamResponse;
import com.myorg.bjf.forwarding.lock.KeyedLock;
import com.myorg.bjf.forwarding.lock.LockHandle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Serializes upstream writes per lock key and coalesces bulk writes into the job recorded
 * in the {@link JobDirectory}.
 *
 * <p>Per request: lock, look up the job, append to it or create one (a failed append falls
 * back to exactly one create), record a created job, unlock. The lock is released on every
 * path. Surfaced failures: {@link LockUnavailableException}, {@link DirectoryReadException},
 * and {@link UpstreamException} from create. Append failures and directory write failures are
 * absorbed.
 */
@Slf4j
@RequiredArgsConstructor
public class JobCoordinator {

    private final KeyedLock lock;
    private final JobDirectory directory;
    private final UpstreamGateway gateway;
    private final JobTtlPolicy ttlPolicy;

    public ForwardResult execute(PendingOperation op) {
        try (LockHandle ignored = lock.acquire(op.lockKey())) {
            Optional<JobRecord> current = directory.lookup(op.jobKey());

            if (current.isEmpty()) {
                return createJob(op, WriteOutcome.CREATED);
            }

            String jobId = current.get().jobId();
            try {
                UpstreamResponse res = gateway.append(op.endpoint(), jobId, op.payload());
                log.debug("Appended {} to jobId={} jobKey={}", op.action().code(), jobId, op.jobKey());
                return new ForwardResult(res, WriteOutcome.APPENDED, jobId);
            } catch (UpstreamException e) {
                // stale or closed job: open a fresh one, the caller never sees this failure
                log.warn("Append to jobId={} failed (status={}), opening a new job for jobKey={}",
                        jobId, e.getStatus(), op.jobKey());
                return createJob(op, WriteOutcome.RECREATED);
            }
        }
    }

    /**
     * Run a plain upstream call while holding {@code lockKey}, for writes that share a user's
     * ordering domain without going through a bulk job.
     */
    public ForwardResult exclusive(String lockKey, Supplier<UpstreamResponse> call) {
        try (LockHandle ignored = lock.acquire(lockKey)) {
            return ForwardResult.direct(call.get());
        }
    }

    private ForwardResult createJob(PendingOperation op, WriteOutcome outcome) {
        CreatedJob job = gateway.create(op.endpoint(), op.payload());
        log.info("Opened bulk job jobId={} jobKey={} closingAt={}", job.id(), op.jobKey(), job.closingAt());
        recordJob(op.jobKey(), job);
        return new ForwardResult(job.response(), outcome, job.id());
    }

    // Failures here only lose coalescing for later callers; the create already succeeded.
    private void recordJob(String jobKey, CreatedJob job) {
        try {
            if (job.id() == null || job.id().isBlank()) {
                log.warn("Upstream returned no job id for jobKey={}, clearing directory entry", jobKey);
                directory.clear(jobKey);
                return;
            }

            Optional<Duration> ttl = ttlPolicy.ttlFor(job.closingAt());
            if (ttl.isEmpty()) {
                log.info("jobId={} closes too soon (closingAt={}), not recording it for jobKey={}",
                        job.id(), job.closingAt(), jobKey);
                directory.clear(jobKey);
                return;
            }
            directory.record(jobKey, job.id(), ttl.get());
        } catch (RuntimeException e) {
            log.warn("Could not record jobId={} for jobKey={}; later writes will open their own job",
                    job.id(), jobKey, e);
        }
    }
}
