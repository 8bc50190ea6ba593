package com.jreinhal.knowledge.session;

import com.jreinhal.knowledge.model.KnowledgeScope;
import java.time.Clock;
import org.springframework.stereotype.Component;

/**
 * Maps request context to a session id and a storage partition.
 *
 * <p>An explicit id or a channel+thread pair yields a stable id. A bare channel or no anchor
 * at all yields a fresh timestamp-suffixed id on every call.</p>
 */
@Component
public class SessionIdentityResolver {
    public static final String SHARED_PARTITION = "shared-knowledge";

    private final Clock clock;

    public SessionIdentityResolver(Clock clock) {
        this.clock = clock;
    }

    public String resolveSessionId(String explicitId, String channelId, String threadId) {
        if (hasText(explicitId)) {
            return explicitId;
        }
        if (hasText(channelId) && hasText(threadId)) {
            return "thread-" + channelId + "-" + threadId;
        }
        long unixSeconds = this.clock.instant().getEpochSecond();
        if (hasText(channelId)) {
            return "channel-" + channelId + "-" + unixSeconds;
        }
        return "api-" + unixSeconds;
    }

    public String resolveUserId(String scope, String channelId, String userId) {
        return resolveUserId(KnowledgeScope.fromConfig(scope), channelId, userId);
    }

    public String resolveUserId(KnowledgeScope scope, String channelId, String userId) {
        if (scope == null) {
            return SHARED_PARTITION;
        }
        return switch (scope) {
            case CHANNEL -> hasText(channelId) ? channelId : SHARED_PARTITION;
            case USER -> hasText(userId) ? userId : SHARED_PARTITION;
            default -> SHARED_PARTITION;
        };
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
