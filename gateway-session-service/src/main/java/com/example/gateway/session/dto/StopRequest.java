package com.example.gateway.session.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StopRequest {

    /** Also delete the stored credentials. */
    private boolean erase;
}
