package com.example.gateway.session.model;

/**
 * Account identity reported by the protocol client once a connection opens.
 *
 * @param networkId    network address of the linked account, e.g. {@code 41791234567@s.whatsapp.net}
 * @param displayPhone phone number as shown to users
 */
public record Identity(String networkId, String displayPhone) {
}
