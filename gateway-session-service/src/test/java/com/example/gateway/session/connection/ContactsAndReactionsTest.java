package com.example.gateway.session.connection;

import com.example.gateway.session.model.Chat;
import com.example.gateway.session.model.Contact;
import com.example.gateway.session.model.Identity;
import com.example.gateway.session.protocol.DisconnectReason;
import com.example.gateway.session.protocol.InboundMessage;
import com.example.gateway.session.protocol.MessageKey;
import com.example.gateway.session.support.FakeProtocolClient;
import com.example.gateway.session.support.GatewayHarness;
import com.example.gateway.shared.exception.MessageNotFoundException;
import com.example.gateway.shared.exception.MessageSendException;
import com.example.gateway.shared.exception.NotConnectedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContactsAndReactionsTest {

    private static final Identity IDENTITY = new Identity("15550001111@s.whatsapp.net", "+15550001111");
    private static final String PEER = "15550002222@s.whatsapp.net";

    private final GatewayHarness harness = new GatewayHarness();
    private FakeProtocolClient client;

    @BeforeEach
    void connect() {
        harness.registry.start("t1", null);
        client = harness.clients.last();
        client.open(IDENTITY);
    }

    @AfterEach
    void tearDown() {
        harness.dispose();
    }

    @Test
    void reactionTargetsTheReceivedMessage() throws Exception {
        client.message(text("m1"));

        String jid = harness.registry.react("t1", "+1 555 000 2222", "m1", "👍").get();

        assertThat(jid).isEqualTo(PEER);
        assertThat(client.reactions()).singleElement().satisfies(reaction -> {
            assertThat(reaction.target()).isEqualTo(new MessageKey(PEER, "m1", false));
            assertThat(reaction.emoji()).isEqualTo("👍");
        });
    }

    @Test
    void unknownMessageIsNotFound() {
        client.message(text("m1"));

        assertThatThrownBy(() -> harness.registry.react("t1", PEER, "m2", "👍"))
                .isInstanceOf(MessageNotFoundException.class);
        assertThat(client.reactions()).isEmpty();
    }

    @Test
    void reactionNeedsAConnectedSession() {
        client.message(text("m1"));
        client.close(DisconnectReason.CONNECTION_LOST);

        assertThatThrownBy(() -> harness.registry.react("t1", PEER, "m1", "👍"))
                .isInstanceOf(NotConnectedException.class);
        assertThatThrownBy(() -> harness.registry.react("t2", PEER, "m1", "👍"))
                .isInstanceOf(NotConnectedException.class);
    }

    @Test
    void failedReactionSurfacesAsMessageSendException() {
        client.message(text("m1"));
        client.failSendsWith(new IOException("socket closed"));

        assertThatThrownBy(() -> harness.registry.react("t1", PEER, "m1", "👍").get())
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(MessageSendException.class);
    }

    @Test
    void contactAndChatSignalsFillTheDirectory() {
        client.contacts(new Contact(PEER, null, "Peer", null, false));
        client.chats(new Chat(PEER, null, 1, Instant.parse("2024-05-01T09:59:00Z")),
                new Chat("999@g.us", "Team", 0, Instant.parse("2024-05-01T09:00:00Z")));
        client.chatsDeleted("999@g.us");

        assertThat(harness.registry.contacts("t1", "peer")).extracting(Contact::name).containsExactly("Peer");
        assertThat(harness.registry.chats("t1")).singleElement().satisfies(chat -> {
            assertThat(chat.jid()).isEqualTo(PEER);
            assertThat(chat.name()).isEqualTo("Peer");
            assertThat(chat.unreadCount()).isEqualTo(1);
        });
    }

    @Test
    void directorySurvivesAPlainStopButNotAnErase() {
        client.contacts(new Contact(PEER, "Peer", null, null, false));

        harness.registry.stop("t1", false);
        assertThat(harness.registry.contacts("t1", null)).hasSize(1);

        harness.registry.stop("t1", true);
        assertThat(harness.registry.contacts("t1", null)).isEmpty();
    }

    @Test
    void logoutClearsTheDirectory() {
        client.contacts(new Contact(PEER, "Peer", null, null, false));
        client.message(text("m1"));

        client.close(DisconnectReason.LOGGED_OUT);

        assertThat(harness.registry.contacts("t1", null)).isEmpty();
        assertThat(harness.directory.findMessage("t1", PEER, "m1")).isEmpty();
    }

    @Test
    void signalsFromAReplacedClientAreIgnored() {
        harness.registry.reset("t1");

        client.contacts(new Contact(PEER, "Stale", null, null, false));

        assertThat(harness.registry.contacts("t1", null)).isEmpty();
    }

    private static InboundMessage text(String id) {
        return new InboundMessage(id, PEER, false, "Peer", "conversation", "hello", null,
                Instant.parse("2024-05-01T09:59:00Z"));
    }
}
