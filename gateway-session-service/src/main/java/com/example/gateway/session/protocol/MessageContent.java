package com.example.gateway.session.protocol;

public record MessageContent(String text) {

    public static MessageContent text(String text) {
        return new MessageContent(text);
    }
}
