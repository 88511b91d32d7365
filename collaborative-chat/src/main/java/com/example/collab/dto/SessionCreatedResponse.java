package com.example.collab.dto;

import com.example.collab.service.CollaborativeSessionService.SessionCreation;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SessionCreatedResponse {
    SessionResponse session;
    ParticipantResponse owner;
    InviteResponse invite;

    public static SessionCreatedResponse from(SessionCreation creation) {
        return SessionCreatedResponse.builder()
                .session(SessionResponse.from(creation.session(), creation.owner().getUserId()))
                .owner(ParticipantResponse.from(creation.owner()))
                .invite(InviteResponse.from(creation.invite()))
                .build();
    }
}
