package com.example.collab.domain;

public enum ParticipantStatus {
    ACCEPTED,
    REMOVED
}
