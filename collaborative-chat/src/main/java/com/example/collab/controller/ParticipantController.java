package com.example.collab.controller;

import com.example.collab.dto.DepartureResponse;
import com.example.collab.dto.JoinRequest;
import com.example.collab.dto.JoinResponse;
import com.example.collab.dto.ParticipantResponse;
import com.example.collab.dto.ParticipantsResponse;
import com.example.collab.dto.TransferOwnershipRequest;
import com.example.collab.dto.TransferResponse;
import com.example.collab.service.CallerIdentityService;
import com.example.collab.service.CollaborativeSessionService;
import com.example.collab.service.MembershipCoordinator;
import com.example.collab.service.MembershipCoordinator.JoinResult;
import com.example.collab.service.MembershipCoordinator.JoinStatus;
import com.example.collab.service.OwnershipTransferService;
import com.example.collab.service.OwnershipTransferService.TransferResult;
import com.example.collab.service.OwnershipTransferService.TransferStatus;
import com.example.collab.service.ParticipantDepartureService;
import com.example.collab.service.exception.ServiceException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/collaborative/{chatId}")
@RequiredArgsConstructor
public class ParticipantController {

    private final MembershipCoordinator membershipCoordinator;
    private final OwnershipTransferService ownershipTransferService;
    private final ParticipantDepartureService departureService;
    private final CollaborativeSessionService sessionService;
    private final CallerIdentityService identityService;

    @PostMapping("/join")
    public ResponseEntity<JoinResponse> join(
            @PathVariable String chatId, @Valid @RequestBody JoinRequest request, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        JoinResult result = membershipCoordinator.join(chatId, callerId, request.getInviteCode());
        if (result.status() != JoinStatus.JOINED) {
            throw new ServiceException(result.reason());
        }
        return ResponseEntity.ok(JoinResponse.builder()
                .chatId(chatId)
                .participant(ParticipantResponse.from(result.participant()))
                .build());
    }

    @PostMapping("/leave")
    public ResponseEntity<DepartureResponse> leave(@PathVariable String chatId, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        return ResponseEntity.ok(DepartureResponse.from(chatId, departureService.leave(chatId, callerId)));
    }

    @GetMapping("/participants")
    public ResponseEntity<ParticipantsResponse> listParticipants(
            @PathVariable String chatId, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        return ResponseEntity.ok(ParticipantsResponse.from(sessionService.listParticipants(chatId, callerId)));
    }

    @DeleteMapping("/participants/{userId}")
    public ResponseEntity<DepartureResponse> removeParticipant(
            @PathVariable String chatId, @PathVariable String userId, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        return ResponseEntity.ok(
                DepartureResponse.from(chatId, departureService.removeParticipant(chatId, callerId, userId)));
    }

    @PutMapping("/owner")
    public ResponseEntity<TransferResponse> transferOwnership(
            @PathVariable String chatId,
            @Valid @RequestBody TransferOwnershipRequest request,
            HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        TransferResult result = ownershipTransferService.transfer(chatId, callerId, request.getNewOwnerId());
        if (result.status() != TransferStatus.TRANSFERRED) {
            throw new ServiceException(result.reason());
        }
        return ResponseEntity.ok(TransferResponse.builder()
                .chatId(chatId)
                .previousOwnerId(result.previousOwnerId())
                .newOwnerId(result.newOwnerId())
                .build());
    }
}
