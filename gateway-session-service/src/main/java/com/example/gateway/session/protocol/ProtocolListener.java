package com.example.gateway.session.protocol;

import com.example.gateway.session.model.Chat;
import com.example.gateway.session.model.Contact;
import com.example.gateway.session.model.Identity;

import java.util.List;

/**
 * Signals emitted by a {@link ProtocolClient} during one connection attempt.
 */
public interface ProtocolListener {

    /** A pairing token (QR payload) must be shown to the account owner. */
    void onPairingToken(String token);

    void onOpen(Identity identity);

    void onClose(DisconnectReason reason, String detail);

    void onMessage(InboundMessage message);

    /** Contacts added or changed, including the initial history sync. Null fields are unknown. */
    void onContacts(List<Contact> contacts);

    /** Chats added or changed. Null fields are unknown. */
    void onChats(List<Chat> chats);

    void onChatsDeleted(List<String> jids);

    /**
     * Any failure not covered by {@link #onClose}. A {@link ProtocolFaultException} flagged
     * configuration-fatal ends the session for good.
     */
    void onFault(Throwable fault);
}
