package com.example.collab.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class JoinResponse {
    String chatId;
    ParticipantResponse participant;
}
