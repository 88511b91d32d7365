package com.example.collab.controller;

import com.example.collab.domain.Invite;
import com.example.collab.dto.CreateInviteRequest;
import com.example.collab.dto.InviteResponse;
import com.example.collab.dto.InviteValidationResponse;
import com.example.collab.service.CallerIdentityService;
import com.example.collab.service.MembershipCoordinator;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/collaborative")
@RequiredArgsConstructor
public class InviteController {

    private final MembershipCoordinator membershipCoordinator;
    private final CallerIdentityService identityService;

    /**
     * Preview for the join page; needs no identity.
     */
    @GetMapping("/invites/{code}")
    public ResponseEntity<InviteValidationResponse> validateInvite(@PathVariable String code) {
        return ResponseEntity.ok(InviteValidationResponse.from(membershipCoordinator.validateInvite(code)));
    }

    @GetMapping("/{chatId}/invites")
    public ResponseEntity<List<InviteResponse>> listActiveInvites(
            @PathVariable String chatId, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        List<Invite> invites = membershipCoordinator.listActiveInvites(chatId, callerId);
        return ResponseEntity.ok(invites.stream().map(InviteResponse::from).toList());
    }

    @PostMapping("/{chatId}/invites")
    public ResponseEntity<InviteResponse> createInvite(
            @PathVariable String chatId,
            @RequestBody(required = false) CreateInviteRequest request,
            HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        Invite invite = membershipCoordinator.createInvite(
                chatId, callerId, request != null ? request.getExpiresIn() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(InviteResponse.from(invite));
    }

    @DeleteMapping("/{chatId}/invites/{inviteId}")
    public ResponseEntity<Map<String, Object>> revokeInvite(
            @PathVariable String chatId, @PathVariable String inviteId, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        boolean revoked = membershipCoordinator.revokeInvite(chatId, callerId, inviteId);
        return ResponseEntity.ok(Map.of("inviteId", inviteId, "revoked", revoked));
    }
}
