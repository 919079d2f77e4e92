package com.example.gateway.shared.exception;

/** The account was logged out remotely. The session closes for good. */
public class TerminalLogoutException extends GatewayException {

    public TerminalLogoutException(String message) {
        super(ErrorCode.LOGGED_OUT, message);
    }
}
