package com.jreinhal.knowledge.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.knowledge.model.KnowledgeScope;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SessionIdentityResolverTest {
    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
    private final SessionIdentityResolver resolver = new SessionIdentityResolver(this.clock);

    @Nested
    @DisplayName("resolveSessionId()")
    class SessionIdTest {
        @Test
        @DisplayName("Explicit id is returned unchanged")
        void explicitIdWins() {
            assertThat(resolver.resolveSessionId("my-session", "C1", "T1")).isEqualTo("my-session");
        }

        @Test
        @DisplayName("Channel and thread yield a stable thread id")
        void channelAndThread() {
            String first = resolver.resolveSessionId(null, "C1", "T1");
            String second = resolver.resolveSessionId("", "C1", "T1");

            assertThat(first).isEqualTo("thread-C1-T1");
            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("Channel alone yields a timestamped channel id")
        void channelOnly() {
            assertThat(resolver.resolveSessionId(null, "C1", null)).isEqualTo("channel-C1-1700000000");
        }

        @Test
        @DisplayName("No anchor yields an api id")
        void noAnchor() {
            assertThat(resolver.resolveSessionId(null, null, null)).isEqualTo("api-1700000000");
        }

        @Test
        @DisplayName("Channel-only ids differ as time moves on")
        void channelOnlyIsNotStable() {
            SessionIdentityResolver later = new SessionIdentityResolver(Clock.offset(clock, java.time.Duration.ofSeconds(5)));

            assertThat(later.resolveSessionId(null, "C1", null))
                    .isNotEqualTo(resolver.resolveSessionId(null, "C1", null));
        }
    }

    @Nested
    @DisplayName("resolveUserId()")
    class UserIdTest {
        @Test
        @DisplayName("Shared scope always uses the shared partition")
        void sharedScope() {
            assertThat(resolver.resolveUserId("shared", "C1", "U1")).isEqualTo(SessionIdentityResolver.SHARED_PARTITION);
        }

        @Test
        @DisplayName("Channel scope partitions by channel, falling back to shared")
        void channelScope() {
            assertThat(resolver.resolveUserId(KnowledgeScope.CHANNEL, "C1", "U1")).isEqualTo("C1");
            assertThat(resolver.resolveUserId(KnowledgeScope.CHANNEL, "", "U1")).isEqualTo("shared-knowledge");
        }

        @Test
        @DisplayName("User scope partitions by user, falling back to shared")
        void userScope() {
            assertThat(resolver.resolveUserId(KnowledgeScope.USER, "C1", "U1")).isEqualTo("U1");
            assertThat(resolver.resolveUserId(KnowledgeScope.USER, "C1", null)).isEqualTo("shared-knowledge");
        }

        @Test
        @DisplayName("Unknown scope falls back to shared")
        void unknownScope() {
            assertThat(resolver.resolveUserId("galaxy", "C1", "U1")).isEqualTo("shared-knowledge");
        }
    }
}
