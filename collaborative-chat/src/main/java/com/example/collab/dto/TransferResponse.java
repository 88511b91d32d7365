package com.example.collab.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TransferResponse {
    String chatId;
    String previousOwnerId;
    String newOwnerId;
}
