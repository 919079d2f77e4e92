package com.example.gateway.shared.exception;

public class MessageSendException extends GatewayException {

    public MessageSendException(String message) {
        super(ErrorCode.SEND_FAILED, message);
    }

    public MessageSendException(String message, Throwable cause) {
        super(ErrorCode.SEND_FAILED, message, cause);
    }
}
