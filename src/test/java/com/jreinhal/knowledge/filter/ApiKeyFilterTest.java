package com.jreinhal.knowledge.filter;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.knowledge.config.ApiKeyProperties;
import com.jreinhal.knowledge.model.AccessRole;
import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.security.CallerContext;
import jakarta.servlet.FilterChain;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class ApiKeyFilterTest {
    private final AtomicReference<CallerIdentity> seen = new AtomicReference<>();
    private final FilterChain chain = (request, response) -> this.seen.set(CallerContext.current());
    private ApiKeyProperties properties;

    @BeforeEach
    void setUp() {
        this.properties = new ApiKeyProperties();
        ApiKeyProperties.Caller slackBot = new ApiKeyProperties.Caller();
        slackBot.setCallerId("slack-bot");
        ApiKeyProperties.Caller dashboard = new ApiKeyProperties.Caller();
        dashboard.setCallerId("dashboard");
        dashboard.setRole("read");
        this.properties.setApiKeys(Map.of("k-write", slackBot, "k-read", dashboard));
    }

    private static MockHttpServletRequest request(String apiKey) {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/query");
        if (apiKey != null) {
            request.addHeader(ApiKeyFilter.API_KEY_HEADER, apiKey);
        }
        return request;
    }

    @Test
    @DisplayName("Known key binds the caller identity for the request")
    void bindsIdentity() throws Exception {
        MockHttpServletRequest request = request("k-write");
        request.addHeader(ApiKeyFilter.SLACK_USER_HEADER, "U1");
        request.addHeader(ApiKeyFilter.USER_EMAIL_HEADER, " a@x.com ");
        request.addHeader(ApiKeyFilter.USER_GROUPS_HEADER, "eng, ops,,");

        new ApiKeyFilter(this.properties).doFilter(request, new MockHttpServletResponse(), this.chain);

        CallerIdentity identity = this.seen.get();
        assertThat(identity.callerId()).isEqualTo("slack-bot");
        assertThat(identity.role()).isEqualTo(AccessRole.WRITE);
        assertThat(identity.email()).isEqualTo("a@x.com");
        assertThat(identity.groups()).containsExactly("eng", "ops");
        assertThat(request.getAttribute(ApiKeyFilter.IDENTITY_ATTRIBUTE)).isEqualTo(identity);
        assertThat(CallerContext.current()).isNull();
    }

    @Test
    @DisplayName("Read key yields a read-only caller")
    void readKey() throws Exception {
        new ApiKeyFilter(this.properties).doFilter(request("k-read"), new MockHttpServletResponse(), this.chain);

        assertThat(this.seen.get().isReadOnly()).isTrue();
    }

    @Test
    @DisplayName("Unknown or missing key is rejected with 401")
    void rejectsUnknownKey() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        new ApiKeyFilter(this.properties).doFilter(request("nope"), response, this.chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("Invalid API key");
        assertThat(this.seen.get()).isNull();
    }

    @Test
    @DisplayName("Health endpoint is not filtered")
    void healthSkipped() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        new ApiKeyFilter(this.properties).doFilter(new MockHttpServletRequest("GET", "/api/health"), response, this.chain);

        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("Without configured keys every caller gets write access")
    void noKeysConfigured() throws Exception {
        new ApiKeyFilter(new ApiKeyProperties()).doFilter(request(null), new MockHttpServletResponse(), this.chain);

        assertThat(this.seen.get().role()).isEqualTo(AccessRole.WRITE);
        assertThat(this.seen.get().callerId()).isNull();
    }
}
