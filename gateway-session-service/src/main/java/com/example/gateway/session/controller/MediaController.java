package com.example.gateway.session.controller;

import com.example.gateway.session.media.MediaCache;
import com.example.gateway.session.media.MediaItem;
import com.example.gateway.session.media.MediaKey;
import com.example.gateway.shared.exception.MediaExpiredException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MediaController {

    private final MediaCache mediaCache;

    @GetMapping("/media/{tenantId}/{messageId}")
    public ResponseEntity<byte[]> media(@PathVariable String tenantId, @PathVariable String messageId) {
        MediaKey key = new MediaKey(TenantIds.requireValid(tenantId), messageId);
        MediaItem item = mediaCache.get(key)
                .orElseThrow(() -> new MediaExpiredException("Media " + messageId + " of tenant " + tenantId + " is not available"));
        return ResponseEntity.ok()
                .contentType(mediaType(item.mime()))
                .contentLength(item.size())
                .header("Content-Disposition", ContentDisposition.inline().filename(item.filename()).build().toString())
                .body(item.bytes());
    }

    private static MediaType mediaType(String mime) {
        try {
            return MediaType.parseMediaType(mime);
        } catch (InvalidMediaTypeException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
