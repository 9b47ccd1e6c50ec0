package com.myorg.bjf.forwarding;

import com.myorg.bjf.contracts.events.EventAction;
import com.myorg.bjf.contracts.events.GroupEvent;
import com.myorg.bjf.contracts.events.IdentifyEvent;
import com.myorg.bjf.contracts.events.TrackEvent;
import com.myorg.bjf.forwarding.coordinator.JobCoordinator;
import com.myorg.bjf.forwarding.gateway.UpstreamGateway;
import com.myorg.bjf.forwarding.mapping.PayloadMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * One upstream request per event, no bulk jobs. group upserts the company first and then
 * the user carrying it.
 */
@Slf4j
public class SingleRecordEventForwarder extends AbstractEventForwarder {

    static final String EVENTS_ENDPOINT = "/events";
    static final String COMPANIES_ENDPOINT = "/companies";

    public SingleRecordEventForwarder(ForwardingValidator validator,
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
        return submit(EventAction.TRACK, event,
                userKey -> ForwardResult.direct(gateway.send(EVENTS_ENDPOINT, mapper.event(event))));
    }

    @Override
    public CompletableFuture<ForwardResult> group(GroupEvent event) {
        return submit(EventAction.GROUP, event, userKey -> {
            gateway.send(COMPANIES_ENDPOINT, mapper.company(event));
            log.debug("Company groupId={} upserted, attaching it to the user", event.getGroupId());
            return upsertUser(userKey, mapper.groupUser(event));
        });
    }

    @Override
    public ForwardingMode mode() {
        return ForwardingMode.SINGLE_RECORD;
    }
}
