package com.example.collab.event;

public enum CollabEventType {
    SESSION_CREATED,
    SESSION_CONVERTED,
    SESSION_DISSOLVED,
    LOCK_ACQUIRED,
    LOCK_RELEASED,
    PARTICIPANT_JOINED,
    PARTICIPANT_LEFT,
    PARTICIPANT_REMOVED,
    OWNERSHIP_TRANSFERRED,
    INVITE_CREATED,
    INVITE_REVOKED,
    PRESENCE_CHANGED,
    TYPING;

    /**
     * Ephemeral signals are only fanned out to sockets, never mirrored to the lifecycle topic.
     */
    public boolean isEphemeral() {
        return this == PRESENCE_CHANGED || this == TYPING;
    }
}
