package com.example.gateway.session.controller;

import com.example.gateway.session.dto.LoopbackInboundRequest;
import com.example.gateway.session.dto.OkResponse;
import com.example.gateway.session.model.Chat;
import com.example.gateway.session.model.Contact;
import com.example.gateway.session.protocol.Jids;
import com.example.gateway.session.protocol.loopback.LoopbackNetwork;
import com.example.gateway.shared.exception.ValidationException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Plays the network side of loopback sessions for local testing. Only registered when
 * {@code gateway.protocol.loopback.dev-endpoints-enabled=true}.
 */
@RestController
@RequestMapping("/dev/loopback/{id}")
@ConditionalOnProperty(prefix = "gateway.protocol.loopback", name = "dev-endpoints-enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class DevLoopbackController {

    private final ObjectProvider<LoopbackNetwork> loopbackNetwork;

    @PostMapping("/pair")
    public ResponseEntity<OkResponse> pair(@PathVariable String id) {
        network().pair(TenantIds.requireValid(id));
        return ResponseEntity.ok(OkResponse.ok());
    }

    @PostMapping("/drop")
    public ResponseEntity<OkResponse> drop(@PathVariable String id) {
        network().drop(TenantIds.requireValid(id));
        return ResponseEntity.ok(OkResponse.ok());
    }

    @PostMapping("/logout")
    public ResponseEntity<OkResponse> logout(@PathVariable String id) {
        network().logout(TenantIds.requireValid(id));
        return ResponseEntity.ok(OkResponse.ok());
    }

    @PostMapping("/inbound")
    public ResponseEntity<Map<String, String>> inbound(@PathVariable String id,
                                                       @Valid @RequestBody LoopbackInboundRequest request) {
        String tenantId = TenantIds.requireValid(id);
        byte[] attachment = null;
        if (request.getAttachmentBase64() != null && !request.getAttachmentBase64().isBlank()) {
            try {
                attachment = Base64.getDecoder().decode(request.getAttachmentBase64());
            } catch (IllegalArgumentException e) {
                throw new ValidationException("attachmentBase64 is not valid base64");
            }
        }
        String messageId = network().deliver(tenantId, Jids.normalize(request.getFrom()), request.getPushName(),
                request.getText(), request.getMimeType(), attachment);
        log.info("Loopback message {} injected for tenant {}", messageId, tenantId);
        return ResponseEntity.ok(Map.of("messageId", messageId));
    }

    @PostMapping("/contacts")
    public ResponseEntity<OkResponse> contacts(@PathVariable String id, @RequestBody List<Contact> contacts) {
        network().syncContacts(TenantIds.requireValid(id), contacts);
        return ResponseEntity.ok(OkResponse.ok());
    }

    @PostMapping("/chats")
    public ResponseEntity<OkResponse> chats(@PathVariable String id, @RequestBody List<Chat> chats) {
        network().syncChats(TenantIds.requireValid(id), chats);
        return ResponseEntity.ok(OkResponse.ok());
    }

    @GetMapping("/sent")
    public ResponseEntity<List<LoopbackNetwork.SentMessage>> sent(@PathVariable String id) {
        return ResponseEntity.ok(network().sentMessages(TenantIds.requireValid(id)));
    }

    private LoopbackNetwork network() {
        LoopbackNetwork network = loopbackNetwork.getIfAvailable();
        if (network == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Loopback network is not in use");
        }
        return network;
    }
}
