package com.jreinhal.knowledge.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "knowledge.permissions")
public class PermissionsProperties {
    /**
     * Email allow-list. Example:
     * knowledge.permissions.allowed-emails[0].value=lead@example.com
     * knowledge.permissions.allowed-emails[0].role=write
     */
    private List<Entry> allowedEmails = new ArrayList<>();

    /**
     * Group allow-list, matched against the caller's group claims.
     */
    private List<Entry> allowedGroups = new ArrayList<>();

    public List<Entry> getAllowedEmails() {
        return allowedEmails;
    }

    public void setAllowedEmails(List<Entry> allowedEmails) {
        this.allowedEmails = allowedEmails;
    }

    public List<Entry> getAllowedGroups() {
        return allowedGroups;
    }

    public void setAllowedGroups(List<Entry> allowedGroups) {
        this.allowedGroups = allowedGroups;
    }

    public static class Entry {
        private String value;
        /**
         * "write" or "read"; empty means write.
         */
        private String role;

        public Entry() {
        }

        public Entry(String value, String role) {
            this.value = value;
            this.role = role;
        }

        public String getValue() {
            return value;
        }

        public void setValue(String value) {
            this.value = value;
        }

        public String getRole() {
            return role;
        }

        public void setRole(String role) {
            this.role = role;
        }
    }
}
