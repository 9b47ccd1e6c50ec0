package com.myorg.bjf.forwarding.coordinator;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.myorg.bjf.contracts.events.EventAction;
import com.myorg.bjf.forwarding.DataType;

/**
 * One caller's bulk write, owned by a single {@link JobCoordinator#execute} call.
 *
 * @param action   originating call, for logs
 * @param lockKey  mutual-exclusion scope
 * @param jobKey   coalescing scope
 * @param dataType selects the bulk endpoint
 * @param userKey  userId or e-mail
 * @param payload  bulk body without the {@code job} reference
 */
public record PendingOperation(
        EventAction action,
        String lockKey,
        String jobKey,
        DataType dataType,
        String userKey,
        ObjectNode payload
) {
    public String endpoint() {
        return dataType.bulkEndpoint();
    }
}
