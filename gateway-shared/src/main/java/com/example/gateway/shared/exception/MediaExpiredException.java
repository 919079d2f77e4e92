package com.example.gateway.shared.exception;

public class MediaExpiredException extends GatewayException {

    public MediaExpiredException(String message) {
        super(ErrorCode.MEDIA_EXPIRED, message);
    }
}
