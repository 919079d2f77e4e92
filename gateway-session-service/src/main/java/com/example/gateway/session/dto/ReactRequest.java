package com.example.gateway.session.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReactRequest {

    @NotBlank(message = "jid is required")
    private String jid; // chat the message was received in; a phone number works too

    @NotBlank(message = "id is required")
    private String id;

    @NotBlank(message = "emoji is required")
    private String emoji;
}
