package com.example.gateway.session.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Body of {@code POST /sessions/{id}/start}. Every field is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionStartRequest {

    // blank removes the webhook
    @Pattern(regexp = "^$|^(?i)https?://[^\\s{}]+$", message = "webhookUrl must be an absolute http or https URL")
    @Size(max = 2048)
    private String webhookUrl;

    @ToString.Exclude
    private String webhookSecret;

    /** Event kinds to forward, e.g. {@code ["message_incoming","media"]}. Empty forwards all. */
    private List<String> webhookEvents;
}
