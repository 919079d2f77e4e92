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
public class SendTextRequest {

    @NotBlank(message = "to is required")
    private String to; // phone number or full JID

    @NotBlank(message = "text is required")
    private String text;
}
