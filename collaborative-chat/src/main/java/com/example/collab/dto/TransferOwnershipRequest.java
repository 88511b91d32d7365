package com.example.collab.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TransferOwnershipRequest {

    @NotBlank
    private String newOwnerId;
}
