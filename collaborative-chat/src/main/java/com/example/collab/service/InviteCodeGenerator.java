package com.example.collab.service;

import com.example.collab.config.CollabProperties;
import java.security.SecureRandom;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class InviteCodeGenerator {

    private static final char[] ALPHABET =
            "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789-_".toCharArray();

    private final SecureRandom random = new SecureRandom();
    private final CollabProperties collabProperties;

    /**
     * URL-safe code; uniqueness is enforced by the caller against the store.
     */
    public String nextCode() {
        int length = collabProperties.getInvite().getCodeLength();
        char[] code = new char[length];
        for (int i = 0; i < length; i++) {
            code[i] = ALPHABET[random.nextInt(ALPHABET.length)];
        }
        return new String(code);
    }
}
