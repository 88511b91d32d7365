package com.example.collab.dto;

import com.example.collab.service.ParticipantRegistry.ParticipantsView;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ParticipantsResponse {
    String chatId;
    String ownerId;
    @JsonProperty("isOwner")
    boolean owner;
    int maxParticipants;
    List<ParticipantResponse> participants;

    public static ParticipantsResponse from(ParticipantsView view) {
        return ParticipantsResponse.builder()
                .chatId(view.chatId())
                .ownerId(view.ownerId())
                .owner(view.callerIsOwner())
                .maxParticipants(view.maxParticipants())
                .participants(view.participants().stream().map(ParticipantResponse::from).toList())
                .build();
    }
}
