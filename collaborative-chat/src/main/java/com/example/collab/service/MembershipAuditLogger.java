package com.example.collab.service;

import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One line per committed membership change on the {@code collab.membership.audit} logger, so operators can route
 * it to a separate appender.
 */
@Component
public class MembershipAuditLogger {

    private static final Logger AUDIT = LoggerFactory.getLogger("collab.membership.audit");

    public void record(String action, String chatId, String actorId, String subjectId) {
        record(action, chatId, actorId, subjectId, Map.of());
    }

    public void record(String action, String chatId, String actorId, String subjectId, Map<String, ?> details) {
        if (!AUDIT.isInfoEnabled()) {
            return;
        }
        String detailText = details == null || details.isEmpty()
                ? ""
                : details.entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + entry.getValue())
                        .collect(Collectors.joining(" ", " ", ""));
        AUDIT.info("MEMBERSHIP_CHANGE action={} chatId={} actor={} subject={}{}",
                action, chatId, actorId, subjectId, detailText);
    }
}
