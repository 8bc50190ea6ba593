package com.jreinhal.knowledge.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "knowledge.auth")
public class ApiKeyProperties {
    /**
     * API key to caller mapping. Empty disables key checks and every caller is anonymous.
     */
    private Map<String, Caller> apiKeys = new LinkedHashMap<>();

    public Map<String, Caller> getApiKeys() {
        return apiKeys;
    }

    public void setApiKeys(Map<String, Caller> apiKeys) {
        this.apiKeys = apiKeys;
    }

    public static class Caller {
        private String callerId;
        private String role = "write";

        public String getCallerId() {
            return callerId;
        }

        public void setCallerId(String callerId) {
            this.callerId = callerId;
        }

        public String getRole() {
            return role;
        }

        public void setRole(String role) {
            this.role = role;
        }
    }
}
