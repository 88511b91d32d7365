package com.example.collab.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Participant implements Serializable {

    private Long id;
    private String chatId;
    private String userId;
    private ParticipantRole role;
    private ParticipantStatus status;
    private int colorIndex;
    private String invitedBy;
    private Instant joinedAt;

    public boolean isAccepted() {
        return status == ParticipantStatus.ACCEPTED;
    }

    public boolean isOwner() {
        return role == ParticipantRole.OWNER;
    }
}
