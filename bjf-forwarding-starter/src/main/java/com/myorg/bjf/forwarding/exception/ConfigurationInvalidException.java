package com.myorg.bjf.forwarding.exception;

import com.myorg.bjf.contracts.core.exception.ForwardingException;
import com.myorg.bjf.contracts.core.exception.ForwardingReason;

// Rejected before any lock or upstream interaction.
public class ConfigurationInvalidException extends ForwardingException {
    public ConfigurationInvalidException(String msg) {
        super(ForwardingReason.CONFIGURATION_INVALID, msg);
    }
}
