package com.example.collab.dto;

import java.util.Set;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SocketHandshakeResponse {
    String chatId;
    String userId;
    Set<String> onlineUsers;
    String lockHolder;
}
