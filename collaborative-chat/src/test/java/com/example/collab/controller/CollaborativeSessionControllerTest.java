package com.example.collab.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.collab.config.CollabSecurityProperties;
import com.example.collab.domain.ChatSession;
import com.example.collab.domain.Invite;
import com.example.collab.domain.Participant;
import com.example.collab.domain.ParticipantRole;
import com.example.collab.domain.ParticipantStatus;
import com.example.collab.service.CallerIdentityService;
import com.example.collab.service.CollaborativeSessionService;
import com.example.collab.service.CollaborativeSessionService.SessionCreation;
import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = CollaborativeSessionController.class)
@Import(CallerIdentityService.class)
class CollaborativeSessionControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired private MockMvc mockMvc;

    @MockBean private CollaborativeSessionService sessionService;

    @Test
    void createReturnsSessionOwnerAndInvite() throws Exception {
        when(sessionService.createSession("alice", "Planning", 3)).thenReturn(creation("chat-1"));

        mockMvc.perform(post("/api/collaborative")
                        .header("X-User-Id", "alice")
                        .header("X-User-Authenticated", "true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"Planning\",\"maxParticipants\":3}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.session.chatId").value("chat-1"))
                .andExpect(jsonPath("$.session.isOwner").value(true))
                .andExpect(jsonPath("$.owner.colorIndex").value(0))
                .andExpect(jsonPath("$.invite.code").value("abc123"))
                .andExpect(jsonPath("$.invite.remainingUses").value(2));
    }

    @Test
    void createWithoutBodyUsesDefaults() throws Exception {
        when(sessionService.createSession(any(), isNull(), isNull())).thenReturn(creation("chat-2"));

        mockMvc.perform(post("/api/collaborative")
                        .header("X-User-Id", "alice")
                        .header("X-User-Authenticated", "true"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.session.chatId").value("chat-2"));
    }

    @Test
    void capacityBelowTwoFailsValidation() throws Exception {
        mockMvc.perform(post("/api/collaborative")
                        .header("X-User-Id", "alice")
                        .header("X-User-Authenticated", "true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"maxParticipants\":1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"))
                .andExpect(jsonPath("$.details[0]").value(startsWith("maxParticipants")));

        verifyNoInteractions(sessionService);
    }

    @Test
    void convertingCollaborativeChatIsUnprocessable() throws Exception {
        when(sessionService.convertToCollaborative("chat-1", "alice", null, null))
                .thenThrow(new ServiceException(FailureReason.ALREADY_COLLABORATIVE));

        mockMvc.perform(post("/api/collaborative/convert")
                        .header("X-User-Id", "alice")
                        .header("X-User-Authenticated", "true")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"chatId\":\"chat-1\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("already_collaborative"));
    }

    @Test
    void mineMarksOwnedChats() throws Exception {
        ChatSession owned = session("chat-1", "bob");
        ChatSession joined = session("chat-2", "alice");
        when(sessionService.listMyChats("bob")).thenReturn(List.of(owned, joined));

        mockMvc.perform(get("/api/collaborative/mine")
                        .header("X-User-Id", "bob")
                        .header("X-User-Authenticated", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].isOwner").value(true))
                .andExpect(jsonPath("$[1].isOwner").value(false));
    }

    private SessionCreation creation(String chatId) {
        Participant owner = Participant.builder()
                .chatId(chatId)
                .userId("alice")
                .role(ParticipantRole.OWNER)
                .status(ParticipantStatus.ACCEPTED)
                .colorIndex(0)
                .invitedBy("alice")
                .joinedAt(NOW)
                .build();
        Invite invite = Invite.builder()
                .id("invite-1")
                .chatId(chatId)
                .code("abc123")
                .createdBy("alice")
                .maxUses(2)
                .useCount(0)
                .active(true)
                .createdAt(NOW)
                .build();
        return new SessionCreation(session(chatId, "alice"), owner, invite);
    }

    private ChatSession session(String chatId, String ownerId) {
        return ChatSession.builder()
                .id(chatId)
                .ownerId(ownerId)
                .collaborative(true)
                .maxParticipants(3)
                .title("Planning")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    @TestConfiguration
    @EnableConfigurationProperties(CollabSecurityProperties.class)
    static class SecurityPropertiesConfig {
    }
}
