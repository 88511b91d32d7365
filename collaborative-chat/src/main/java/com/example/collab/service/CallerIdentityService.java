package com.example.collab.service;

import com.example.collab.config.CollabSecurityProperties;
import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the verified caller from the identity headers the gateway forwards. Authentication itself happens
 * upstream.
 */
@Component
@RequiredArgsConstructor
public class CallerIdentityService {

    private final CollabSecurityProperties securityProperties;

    public String requireCaller(HttpServletRequest request) {
        return requireCaller(
                request.getHeader(securityProperties.getUserIdHeader()),
                request.getHeader(securityProperties.getAuthenticatedHeader()));
    }

    public String requireCaller(String userId, String authenticatedFlag) {
        if (!StringUtils.hasText(userId)) {
            throw new ServiceException(FailureReason.MISSING_USER_ID, "User identifier is required");
        }
        if (!Boolean.parseBoolean(StringUtils.trimWhitespace(authenticatedFlag))) {
            throw new ServiceException(FailureReason.UNAUTHENTICATED, "User is not authenticated");
        }
        return userId.trim();
    }
}
