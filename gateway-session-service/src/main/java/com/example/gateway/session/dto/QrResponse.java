package com.example.gateway.session.dto;

import com.example.gateway.session.model.SessionSnapshot;
import com.example.gateway.session.model.SessionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code qr} is null unless the session is waiting to be paired.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QrResponse {

    private String id;
    private SessionStatus status;
    private String qr;

    public static QrResponse from(SessionSnapshot snapshot) {
        return new QrResponse(snapshot.id(), snapshot.status(), snapshot.qr());
    }
}
