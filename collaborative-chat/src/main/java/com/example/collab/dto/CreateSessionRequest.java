package com.example.collab.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateSessionRequest {

    @Size(max = 255)
    private String title;

    @Min(2)
    private Integer maxParticipants;
}
