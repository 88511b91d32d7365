package com.example.collab.controller;

import com.example.collab.domain.ChatSession;
import com.example.collab.dto.ConvertSessionRequest;
import com.example.collab.dto.CreateSessionRequest;
import com.example.collab.dto.SessionCreatedResponse;
import com.example.collab.dto.SessionResponse;
import com.example.collab.service.CallerIdentityService;
import com.example.collab.service.CollaborativeSessionService;
import com.example.collab.service.CollaborativeSessionService.SessionCreation;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/collaborative")
public class CollaborativeSessionController {

    private final CollaborativeSessionService sessionService;
    private final CallerIdentityService identityService;

    public CollaborativeSessionController(
            CollaborativeSessionService sessionService, CallerIdentityService identityService) {
        this.sessionService = sessionService;
        this.identityService = identityService;
    }

    @PostMapping
    public ResponseEntity<SessionCreatedResponse> createSession(
            @Valid @RequestBody(required = false) CreateSessionRequest request, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        CreateSessionRequest body = request != null ? request : new CreateSessionRequest();
        SessionCreation creation = sessionService.createSession(callerId, body.getTitle(), body.getMaxParticipants());
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionCreatedResponse.from(creation));
    }

    @PostMapping("/convert")
    public ResponseEntity<SessionCreatedResponse> convert(
            @Valid @RequestBody ConvertSessionRequest request, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        SessionCreation creation = sessionService.convertToCollaborative(
                request.getChatId(), callerId, request.getTitle(), request.getMaxParticipants());
        return ResponseEntity.ok(SessionCreatedResponse.from(creation));
    }

    @GetMapping("/mine")
    public ResponseEntity<List<SessionResponse>> listMyChats(HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        List<ChatSession> chats = sessionService.listMyChats(callerId);
        return ResponseEntity.ok(chats.stream().map(chat -> SessionResponse.from(chat, callerId)).toList());
    }
}
