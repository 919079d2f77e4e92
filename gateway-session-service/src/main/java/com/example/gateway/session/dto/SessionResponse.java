package com.example.gateway.session.dto;

import com.example.gateway.session.model.Identity;
import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.model.SessionStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionResponse {

    private String id;
    private SessionStatus status;
    private Identity identity;

    public static SessionResponse from(SessionSnapshot snapshot) {
        return SessionResponse.builder()
                .id(snapshot.id())
                .status(snapshot.status())
                .identity(snapshot.identity())
                .build();
    }
}
