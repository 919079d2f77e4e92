package com.example.gateway.session.dto;

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
public class OkResponse {

    private boolean ok;
    private String to;

    public static OkResponse ok() {
        return new OkResponse(true, null);
    }

    public static OkResponse sentTo(String jid) {
        return new OkResponse(true, jid);
    }
}
