package com.example.collab.service.exception;

import java.util.Locale;
import org.springframework.http.HttpStatus;

/**
 * Stable reason codes returned to callers. The code string is part of the public API and must not change
 * once released.
 */
public enum FailureReason {
    MISSING_USER_ID(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, "User identifier is required"),
    INVALID_REQUEST(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, "Request is invalid"),
    SELF_TRANSFER(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, "Ownership cannot be transferred to yourself"),

    UNAUTHENTICATED(ErrorCategory.AUTH, HttpStatus.UNAUTHORIZED, "User is not authenticated"),
    NOT_A_MEMBER(ErrorCategory.AUTH, HttpStatus.FORBIDDEN, "User is not a member of this chat"),
    NOT_OWNER(ErrorCategory.AUTH, HttpStatus.FORBIDDEN, "Only the chat owner can do this"),

    CHAT_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "Chat not found"),
    INVITE_INVALID(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "Invite is not valid for this chat"),
    INVITE_EXPIRED(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "Invite has expired"),
    INVITE_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "Invite not found"),
    PARTICIPANT_NOT_FOUND(ErrorCategory.NOT_FOUND, HttpStatus.NOT_FOUND, "Participant not found"),

    CAPACITY_REACHED(ErrorCategory.CONFLICT, HttpStatus.CONFLICT, "Chat is full"),
    ALREADY_MEMBER(ErrorCategory.CONFLICT, HttpStatus.CONFLICT, "User is already a member of this chat"),
    INVITE_EXHAUSTED(ErrorCategory.CONFLICT, HttpStatus.CONFLICT, "Invite has no uses left"),
    NEW_OWNER_NOT_MEMBER(ErrorCategory.CONFLICT, HttpStatus.CONFLICT, "New owner is not an accepted participant"),
    CONCURRENT_UPDATE(ErrorCategory.CONFLICT, HttpStatus.CONFLICT, "The chat was modified concurrently, please retry"),

    OWNER_HAS_PARTICIPANTS(ErrorCategory.STATE, HttpStatus.UNPROCESSABLE_ENTITY, "Transfer ownership or remove the other participants before leaving"),
    OWNER_NOT_REMOVABLE(ErrorCategory.STATE, HttpStatus.UNPROCESSABLE_ENTITY, "The owner cannot be removed"),
    NOT_COLLABORATIVE(ErrorCategory.STATE, HttpStatus.UNPROCESSABLE_ENTITY, "Chat is not collaborative"),
    ALREADY_COLLABORATIVE(ErrorCategory.STATE, HttpStatus.UNPROCESSABLE_ENTITY, "Chat is already collaborative"),

    STORE_UNAVAILABLE(ErrorCategory.UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, "Storage is temporarily unavailable");

    private final ErrorCategory category;
    private final HttpStatus status;
    private final String defaultMessage;

    FailureReason(ErrorCategory category, HttpStatus status, String defaultMessage) {
        this.category = category;
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
