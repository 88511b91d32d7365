package com.example.collab.dto;

import com.example.collab.service.ParticipantDepartureService.DepartureResult;
import com.example.collab.service.ParticipantDepartureService.DepartureStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DepartureResponse {
    String chatId;
    DepartureStatus status;
    String userId;
    boolean lockReleased;

    public static DepartureResponse from(String chatId, DepartureResult result) {
        return DepartureResponse.builder()
                .chatId(chatId)
                .status(result.status())
                .userId(result.userId())
                .lockReleased(result.lockReleased())
                .build();
    }
}
