package com.example.collab.dto;

import com.example.collab.domain.Participant;
import com.example.collab.domain.ParticipantRole;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParticipantResponse {
    String userId;
    ParticipantRole role;
    int colorIndex;
    String invitedBy;
    Instant joinedAt;

    public static ParticipantResponse from(Participant participant) {
        return ParticipantResponse.builder()
                .userId(participant.getUserId())
                .role(participant.getRole())
                .colorIndex(participant.getColorIndex())
                .invitedBy(participant.getInvitedBy())
                .joinedAt(participant.getJoinedAt())
                .build();
    }
}
