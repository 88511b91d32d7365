package com.example.collab.dto;

import com.example.collab.service.MembershipCoordinator.InviteSummary;
import com.example.collab.service.MembershipCoordinator.InviteValidation;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InviteValidationResponse {
    boolean valid;
    String reason;
    InviteSummary summary;

    public static InviteValidationResponse from(InviteValidation validation) {
        return InviteValidationResponse.builder()
                .valid(validation.valid())
                .reason(validation.reason() != null ? validation.reason().code() : null)
                .summary(validation.summary())
                .build();
    }
}
