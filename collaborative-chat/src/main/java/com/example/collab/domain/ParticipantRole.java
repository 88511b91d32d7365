package com.example.collab.domain;

public enum ParticipantRole {
    OWNER,
    PARTICIPANT
}
