package com.example.gateway.session.dto;

import com.example.gateway.session.model.Chat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatsResponse {

    private int count;
    private List<Chat> chats;

    public static ChatsResponse of(List<Chat> chats) {
        return new ChatsResponse(chats.size(), chats);
    }
}
