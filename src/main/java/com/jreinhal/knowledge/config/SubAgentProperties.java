package com.jreinhal.knowledge.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "knowledge.async")
public class SubAgentProperties {
    /**
     * Feed sub-agent results back into the agent as a follow-up query.
     */
    private boolean callbackEnabled = true;

    private int timeoutMinutes = 15;

    private int maxConcurrent = 100;

    /**
     * How long shutdown waits for running tasks before cancelling them.
     */
    private int shutdownGraceSeconds = 30;

    private List<SubAgent> subAgents = new ArrayList<>();

    public Optional<SubAgent> find(String name) {
        return subAgents.stream().filter(a -> a.getName() != null && a.getName().equals(name)).findFirst();
    }

    public boolean isCallbackEnabled() {
        return callbackEnabled;
    }

    public void setCallbackEnabled(boolean callbackEnabled) {
        this.callbackEnabled = callbackEnabled;
    }

    public int getTimeoutMinutes() {
        return timeoutMinutes;
    }

    public void setTimeoutMinutes(int timeoutMinutes) {
        this.timeoutMinutes = timeoutMinutes;
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public void setMaxConcurrent(int maxConcurrent) {
        this.maxConcurrent = maxConcurrent;
    }

    public int getShutdownGraceSeconds() {
        return shutdownGraceSeconds;
    }

    public void setShutdownGraceSeconds(int shutdownGraceSeconds) {
        this.shutdownGraceSeconds = shutdownGraceSeconds;
    }

    public List<SubAgent> getSubAgents() {
        return subAgents;
    }

    public void setSubAgents(List<SubAgent> subAgents) {
        this.subAgents = subAgents;
    }

    public static class SubAgent {
        private String name;
        private String description;
        /**
         * Base URL; requests go to {@code {endpoint}/a2a}.
         */
        private String endpoint;
        private String authHeader;
        private String authToken;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getAuthHeader() {
            return authHeader;
        }

        public void setAuthHeader(String authHeader) {
            this.authHeader = authHeader;
        }

        public String getAuthToken() {
            return authToken;
        }

        public void setAuthToken(String authToken) {
            this.authToken = authToken;
        }
    }
}
