package com.example.collab.websocket;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Socket session to chat membership, kept in Redis so any replica can resolve a session it did not accept.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionBinding implements Serializable {

    private String sessionId;
    private String chatId;
    private String userId;
    private Instant connectedAt;
}
