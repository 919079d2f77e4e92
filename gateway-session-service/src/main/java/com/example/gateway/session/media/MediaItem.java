package com.example.gateway.session.media;

import java.time.Instant;

/**
 * Captured attachment bytes. The array is never modified after capture and must not be
 * modified by readers.
 *
 * @param contentHash lowercase hex SHA-256 of {@code bytes}
 */
public record MediaItem(
        byte[] bytes,
        String mime,
        String filename,
        long size,
        String contentHash,
        Instant capturedAt) {

    @Override
    public String toString() {
        return "MediaItem[mime=" + mime + ", filename=" + filename + ", size=" + size
                + ", contentHash=" + contentHash + ", capturedAt=" + capturedAt + "]";
    }
}
