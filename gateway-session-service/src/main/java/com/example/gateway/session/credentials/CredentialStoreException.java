package com.example.gateway.session.credentials;

import com.example.gateway.session.protocol.ProtocolFaultException;

/**
 * The credential store cannot be read or written. Always configuration-fatal.
 */
public class CredentialStoreException extends ProtocolFaultException {

    public CredentialStoreException(String message, Throwable cause) {
        super(message, true, cause);
    }
}
