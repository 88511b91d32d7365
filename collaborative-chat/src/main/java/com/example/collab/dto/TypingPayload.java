package com.example.collab.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

@Data
public class TypingPayload {

    @JsonAlias("isTyping")
    private boolean typing;
}
