package com.example.gateway.session.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Message to inject through the loopback network.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LoopbackInboundRequest {

    @NotBlank(message = "from is required")
    private String from;

    private String pushName;

    private String text;

    private String mimeType;

    /** Base64 attachment body; omit for text-only messages. */
    private String attachmentBase64;
}
