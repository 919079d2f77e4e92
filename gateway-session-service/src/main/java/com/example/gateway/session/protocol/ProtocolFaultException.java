package com.example.gateway.session.protocol;

import com.example.gateway.shared.exception.ErrorCode;
import com.example.gateway.shared.exception.GatewayException;
import lombok.Getter;

/**
 * Unrecoverable fault reported by a protocol client. When {@code configurationFatal} is set
 * (for example the credential store is unusable) retrying cannot help and the session ends.
 */
@Getter
public class ProtocolFaultException extends GatewayException {

    private final boolean configurationFatal;

    public ProtocolFaultException(String message, boolean configurationFatal) {
        super(configurationFatal ? ErrorCode.CONFIGURATION_FATAL : ErrorCode.PROTOCOL_FAULT, message);
        this.configurationFatal = configurationFatal;
    }

    public ProtocolFaultException(String message, boolean configurationFatal, Throwable cause) {
        super(configurationFatal ? ErrorCode.CONFIGURATION_FATAL : ErrorCode.PROTOCOL_FAULT, message, cause);
        this.configurationFatal = configurationFatal;
    }
}
