package com.example.gateway.session.controller;

import com.example.gateway.session.dto.ChatsResponse;
import com.example.gateway.session.dto.ContactsResponse;
import com.example.gateway.session.dto.OkResponse;
import com.example.gateway.session.dto.QrResponse;
import com.example.gateway.session.dto.ReactRequest;
import com.example.gateway.session.dto.SendTextRequest;
import com.example.gateway.session.dto.SessionResponse;
import com.example.gateway.session.dto.SessionStartRequest;
import com.example.gateway.session.dto.StopRequest;
import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.registry.SessionRegistry;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

/**
 * Session lifecycle. Registry calls may touch the credential store or the protocol client, so
 * they run on the I/O scheduler rather than the event loop.
 */
@RestController
@RequestMapping("/sessions")
@Slf4j
public class SessionController {

    private final SessionRegistry sessionRegistry;
    private final Scheduler ioScheduler;

    public SessionController(SessionRegistry sessionRegistry, @Qualifier("gatewayIoScheduler") Scheduler ioScheduler) {
        this.sessionRegistry = sessionRegistry;
        this.ioScheduler = ioScheduler;
    }

    @PostMapping("/{id}/start")
    public Mono<ResponseEntity<SessionResponse>> start(@PathVariable String id,
                                                       @Valid @RequestBody(required = false) SessionStartRequest request) {
        String tenantId = TenantIds.requireValid(id);
        log.info("Start requested for tenant {}", tenantId);
        return Mono.fromCallable(() -> sessionRegistry.start(tenantId, request))
                .subscribeOn(ioScheduler)
                .map(snapshot -> ResponseEntity.ok(SessionResponse.from(snapshot)));
    }

    @PostMapping("/{id}/reset")
    public Mono<ResponseEntity<SessionResponse>> reset(@PathVariable String id) {
        String tenantId = TenantIds.requireValid(id);
        log.info("Reset requested for tenant {}", tenantId);
        return Mono.fromCallable(() -> sessionRegistry.reset(tenantId))
                .subscribeOn(ioScheduler)
                .map(snapshot -> ResponseEntity.ok(SessionResponse.from(snapshot)));
    }

    @PostMapping("/{id}/stop")
    public Mono<ResponseEntity<OkResponse>> stop(@PathVariable String id,
                                                 @RequestBody(required = false) StopRequest request) {
        String tenantId = TenantIds.requireValid(id);
        boolean erase = request != null && request.isErase();
        log.info("Stop requested for tenant {} (erase={})", tenantId, erase);
        return Mono.fromRunnable(() -> sessionRegistry.stop(tenantId, erase))
                .subscribeOn(ioScheduler)
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(OkResponse.ok())));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<SessionResponse> status(@PathVariable String id) {
        return ResponseEntity.ok(SessionResponse.from(sessionRegistry.status(TenantIds.requireValid(id))));
    }

    @GetMapping("/{id}/qr")
    public ResponseEntity<QrResponse> qr(@PathVariable String id) {
        return ResponseEntity.ok(QrResponse.from(sessionRegistry.status(TenantIds.requireValid(id))));
    }

    @PostMapping("/{id}/send-text")
    public Mono<ResponseEntity<OkResponse>> sendText(@PathVariable String id,
                                                     @Valid @RequestBody SendTextRequest request) {
        String tenantId = TenantIds.requireValid(id);
        return Mono.defer(() -> Mono.fromFuture(sessionRegistry.sendText(tenantId, request.getTo(), request.getText())))
                .map(jid -> ResponseEntity.ok(OkResponse.sentTo(jid)));
    }

    @PostMapping("/{id}/react")
    public Mono<ResponseEntity<OkResponse>> react(@PathVariable String id,
                                                  @Valid @RequestBody ReactRequest request) {
        String tenantId = TenantIds.requireValid(id);
        return Mono.defer(() -> Mono.fromFuture(
                        sessionRegistry.react(tenantId, request.getJid(), request.getId(), request.getEmoji())))
                .map(jid -> ResponseEntity.ok(OkResponse.sentTo(jid)));
    }

    @GetMapping("/{id}/contacts")
    public ResponseEntity<ContactsResponse> contacts(@PathVariable String id,
                                                     @RequestParam(name = "q", required = false) String query) {
        return ResponseEntity.ok(ContactsResponse.of(sessionRegistry.contacts(TenantIds.requireValid(id), query)));
    }

    @GetMapping("/{id}/chats")
    public ResponseEntity<ChatsResponse> chats(@PathVariable String id) {
        return ResponseEntity.ok(ChatsResponse.of(sessionRegistry.chats(TenantIds.requireValid(id))));
    }

    @GetMapping
    public ResponseEntity<List<SessionSnapshot>> list() {
        return ResponseEntity.ok(sessionRegistry.list());
    }
}
