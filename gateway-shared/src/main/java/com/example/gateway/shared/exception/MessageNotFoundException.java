package com.example.gateway.shared.exception;

public class MessageNotFoundException extends GatewayException {

    public MessageNotFoundException(String message) {
        super(ErrorCode.MESSAGE_NOT_FOUND, message);
    }
}
