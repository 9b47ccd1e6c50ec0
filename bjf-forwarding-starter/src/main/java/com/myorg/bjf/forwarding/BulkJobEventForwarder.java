package com.myorg.bjf.forwarding;

import com.myorg.bjf.contracts.events.EventAction;
import com.myorg.bjf.contracts.events.GroupEvent;
import com.myorg.bjf.contracts.events.IdentifyEvent;
import com.myorg.bjf.contracts.events.TrackEvent;
import com.myorg.bjf.forwarding.coordinator.JobCoordinator;
import com.myorg.bjf.forwarding.coordinator.PendingOperation;
import com.myorg.bjf.forwarding.gateway.UpstreamGateway;
import com.myorg.bjf.forwarding.mapping.PayloadMapper;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * identify goes straight to {@code /users}; track and group are coalesced into per-user bulk
 * jobs ({@code /bulk/events}, {@code /bulk/users}).
 */
public class BulkJobEventForwarder extends AbstractEventForwarder {

    public BulkJobEventForwarder(ForwardingValidator validator,
                                 ForwardingKeys keys,
                                 PayloadMapper mapper,
                                 UpstreamGateway gateway,
                                 JobCoordinator coordinator,
                                 Executor executor) {
        super(validator, keys, mapper, gateway, coordinator, executor);
    }

    @Override
    public CompletableFuture<ForwardResult> identify(IdentifyEvent event) {
        return submit(EventAction.IDENTIFY, event, userKey -> upsertUser(userKey, mapper.user(event)));
    }

    @Override
    public CompletableFuture<ForwardResult> track(TrackEvent event) {
        return submit(EventAction.TRACK, event, userKey -> coordinator.execute(new PendingOperation(
                EventAction.TRACK,
                keys.lockKey(userKey),
                keys.jobKey(DataType.EVENTS, userKey),
                DataType.EVENTS,
                userKey,
                mapper.bulk(DataType.EVENTS, mapper.event(event)))));
    }

    // separate lock domain: company upserts do not need ordering against identify
    @Override
    public CompletableFuture<ForwardResult> group(GroupEvent event) {
        return submit(EventAction.GROUP, event, userKey -> coordinator.execute(new PendingOperation(
                EventAction.GROUP,
                keys.groupLockKey(userKey),
                keys.jobKey(DataType.USERS, userKey),
                DataType.USERS,
                userKey,
                mapper.bulk(DataType.USERS, mapper.groupUser(event)))));
    }

    @Override
    public ForwardingMode mode() {
        return ForwardingMode.BULK_JOB;
    }
}
