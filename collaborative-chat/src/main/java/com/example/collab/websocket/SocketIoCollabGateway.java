package com.example.collab.websocket;

import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.HandshakeData;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.example.collab.config.CollabProperties;
import com.example.collab.config.CollabSecurityProperties;
import com.example.collab.domain.ChatLock;
import com.example.collab.dto.SocketHandshakeResponse;
import com.example.collab.dto.TypingPayload;
import com.example.collab.event.CollabEvent;
import com.example.collab.event.CollabEventListener;
import com.example.collab.event.CollabEventPublisher;
import com.example.collab.event.CollabEventType;
import com.example.collab.service.CallerIdentityService;
import com.example.collab.service.LockManager;
import com.example.collab.service.ParticipantRegistry;
import com.example.collab.service.PresenceService;
import com.example.collab.service.RedisKeyFactory;
import com.example.collab.service.exception.ServiceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RMapCache;
import org.redisson.api.RedissonClient;
import org.redisson.codec.TypedJsonJacksonCodec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Realtime channel: one Socket.IO room per chat. Only members may join a room; everything sent here is a
 * notification, clients re-query the REST API for state.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "collab.socketio", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SocketIoCollabGateway implements CollabEventListener {

    static final String COLLAB_EVENT = "collab:event";
    static final String TYPING_EVENT = "collab:typing";
    static final String READY_EVENT = "collab:ready";
    static final String ERROR_EVENT = "collab:error";

    private static final String PARAM_CHAT_ID = "chatId";
    private static final String PARAM_USER_ID = "userId";
    private static final String ATTR_CHAT_ID = "chatId";
    private static final String ATTR_USER_ID = "userId";

    private final SocketIOServer socketIOServer;
    private final CallerIdentityService identityService;
    private final ParticipantRegistry participantRegistry;
    private final LockManager lockManager;
    private final PresenceService presenceService;
    private final CollabEventPublisher eventPublisher;
    private final RedisKeyFactory keyFactory;
    private final RedissonClient redissonClient;
    private final CollabProperties collabProperties;
    private final CollabSecurityProperties securityProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private RMapCache<String, SessionBinding> sessionRegistry;

    @PostConstruct
    public void registerListeners() {
        TypedJsonJacksonCodec sessionCodec = new TypedJsonJacksonCodec(String.class, SessionBinding.class, objectMapper);
        sessionRegistry = redissonClient.getMapCache(keyFactory.socketSessionMapKey(), sessionCodec);
        socketIOServer.addConnectListener(this::handleConnect);
        socketIOServer.addDisconnectListener(this::handleDisconnect);
        socketIOServer.addEventListener(TYPING_EVENT, TypingPayload.class, this::handleTyping);
    }

    private void handleConnect(SocketIOClient client) {
        try {
            HandshakeData handshake = client.getHandshakeData();
            String chatId = handshake.getSingleUrlParam(PARAM_CHAT_ID);
            String headerUser = handshake.getHttpHeaders().get(securityProperties.getUserIdHeader());
            String userId = identityService.requireCaller(
                    StringUtils.hasText(headerUser) ? headerUser : handshake.getSingleUrlParam(PARAM_USER_ID),
                    handshake.getHttpHeaders().get(securityProperties.getAuthenticatedHeader()));
            if (!StringUtils.hasText(chatId)) {
                throw new IllegalArgumentException("chatId is required");
            }
            participantRegistry.requireActiveMember(chatId, userId);

            client.set(ATTR_CHAT_ID, chatId);
            client.set(ATTR_USER_ID, userId);
            storeSession(new SessionBinding(client.getSessionId().toString(), chatId, userId, clock.instant()));
            client.joinRoom(chatId);
            presenceService.markOnline(chatId, userId);

            client.sendEvent(READY_EVENT, SocketHandshakeResponse.builder()
                    .chatId(chatId)
                    .userId(userId)
                    .onlineUsers(presenceService.onlineUsers(chatId))
                    .lockHolder(lockManager.currentLock(chatId).map(ChatLock::getLockedBy).orElse(null))
                    .build());
            publishPresence(chatId);
            log.info("Client {} connected as {} to chat {}", client.getSessionId(), userId, chatId);
        } catch (ServiceException | IllegalArgumentException ex) {
            log.debug("Rejected socket {}: {}", client.getSessionId(), ex.getMessage());
            rejectClient(client, ex);
        } catch (RuntimeException ex) {
            log.error("Failed to handle connect", ex);
            rejectClient(client, ex);
        }
    }

    private void rejectClient(SocketIOClient client, RuntimeException ex) {
        removeSession(client.getSessionId());
        client.sendEvent(ERROR_EVENT, Map.of("message", String.valueOf(ex.getMessage())));
        client.disconnect();
    }

    private void handleDisconnect(SocketIOClient client) {
        UUID sessionId = client.getSessionId();
        SessionBinding binding = removeSession(sessionId);
        String chatId = client.get(ATTR_CHAT_ID);
        String userId = client.get(ATTR_USER_ID);
        if (binding != null) {
            chatId = chatId != null ? chatId : binding.getChatId();
            userId = userId != null ? userId : binding.getUserId();
        }
        if (chatId == null || userId == null) {
            return;
        }
        presenceService.markOffline(chatId, userId);
        publishPresence(chatId);
        log.info("Client {} disconnected from chat {}", sessionId, chatId);
    }

    private void handleTyping(SocketIOClient client, TypingPayload payload, AckRequest ackSender) {
        String chatId = client.get(ATTR_CHAT_ID);
        String userId = client.get(ATTR_USER_ID);
        if (chatId == null || userId == null) {
            client.disconnect();
            return;
        }
        if (!participantRegistry.isActiveMember(chatId, userId)) {
            log.debug("Dropping typing from {} on chat {}: no longer a member", userId, chatId);
            client.leaveRoom(chatId);
            client.disconnect();
            return;
        }
        presenceService.markOnline(chatId, userId);
        eventPublisher.publish(CollabEventType.TYPING, chatId,
                Map.of("userId", userId, "isTyping", payload != null && payload.isTyping()));
    }

    @Override
    public void onCollabEvent(CollabEvent event) {
        if (!StringUtils.hasText(event.getChatId())) {
            return;
        }
        socketIOServer.getRoomOperations(event.getChatId()).sendEvent(COLLAB_EVENT, event);

        if (event.getType() == CollabEventType.PARTICIPANT_LEFT
                || event.getType() == CollabEventType.PARTICIPANT_REMOVED) {
            Object departed = event.getPayload() != null ? event.getPayload().get("userId") : null;
            evict(event.getChatId(), departed);
        } else if (event.getType() == CollabEventType.SESSION_DISSOLVED) {
            evict(event.getChatId(), null);
        }
    }

    /**
     * Drops local sockets of a departed user (or of everyone, for a {@code null} user) from the chat's room.
     */
    private void evict(String chatId, Object userId) {
        for (SocketIOClient client : socketIOServer.getRoomOperations(chatId).getClients()) {
            if (userId == null || userId.equals(client.get(ATTR_USER_ID))) {
                client.leaveRoom(chatId);
            }
        }
    }

    private void publishPresence(String chatId) {
        eventPublisher.publish(CollabEventType.PRESENCE_CHANGED, chatId,
                Map.of("onlineUsers", presenceService.onlineUsers(chatId)));
    }

    private void storeSession(SessionBinding binding) {
        Duration ttl = collabProperties.getRedis().getPresenceTtl();
        if (ttl != null && !ttl.isNegative() && !ttl.isZero()) {
            sessionRegistry.fastPut(binding.getSessionId(), binding, ttl.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            sessionRegistry.fastPut(binding.getSessionId(), binding);
        }
    }

    private SessionBinding removeSession(UUID sessionId) {
        if (sessionRegistry == null) {
            return null;
        }
        return sessionRegistry.remove(sessionId.toString());
    }

    @PreDestroy
    public void shutdown() {
        socketIOServer.removeAllListeners(TYPING_EVENT);
    }
}
