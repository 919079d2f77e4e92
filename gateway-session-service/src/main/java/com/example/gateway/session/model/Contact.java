package com.example.gateway.session.model;

/**
 * An address book entry as the network reports it.
 *
 * @param name         display name: saved name, else the contact's own push name, else the
 *                     verified business name
 * @param notify       the push name the contact chose for themselves
 * @param verifiedName name verified for business accounts
 */
public record Contact(String jid, String name, String notify, String verifiedName, boolean business) {
}
