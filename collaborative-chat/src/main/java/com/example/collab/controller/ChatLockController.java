package com.example.collab.controller;

import com.example.collab.dto.LockResponse;
import com.example.collab.dto.PromptStatusResponse;
import com.example.collab.service.CallerIdentityService;
import com.example.collab.service.LockManager;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Prompt lock. A denied acquisition is a normal 200 answer with {@code acquired=false} and the current holder.
 */
@RestController
@RequestMapping("/api/collaborative/{chatId}/lock")
@RequiredArgsConstructor
public class ChatLockController {

    private final LockManager lockManager;
    private final CallerIdentityService identityService;

    @GetMapping
    public ResponseEntity<PromptStatusResponse> canPrompt(@PathVariable String chatId, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        return ResponseEntity.ok(
                PromptStatusResponse.from(chatId, lockManager.canPrompt(chatId, callerId), lockManager.lease()));
    }

    @PostMapping
    public ResponseEntity<LockResponse> acquire(@PathVariable String chatId, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        return ResponseEntity.ok(LockResponse.from(lockManager.acquire(chatId, callerId)));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> release(@PathVariable String chatId, HttpServletRequest httpRequest) {
        String callerId = identityService.requireCaller(httpRequest);
        boolean released = lockManager.release(chatId, callerId);
        return ResponseEntity.ok(Map.of("chatId", chatId, "released", released));
    }
}
