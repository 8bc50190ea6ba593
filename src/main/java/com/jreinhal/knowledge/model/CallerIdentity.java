package com.jreinhal.knowledge.model;

import java.util.List;

/**
 * Permission-relevant identity of the caller behind one request.
 */
public record CallerIdentity(String callerId, String slackUserId, AccessRole role, String email, List<String> groups) {

    public CallerIdentity {
        role = role == null ? AccessRole.WRITE : role;
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public static CallerIdentity anonymous() {
        return new CallerIdentity(null, null, AccessRole.WRITE, null, List.of());
    }

    public boolean isReadOnly() {
        return this.role == AccessRole.READ;
    }

    /**
     * True when the identity carries no claim at all. A read-only role counts as a claim.
     */
    public boolean isEmpty() {
        return this.role == AccessRole.WRITE && isBlank(this.callerId) && isBlank(this.slackUserId)
                && isBlank(this.email) && this.groups.isEmpty();
    }

    public String displayId() {
        if (!isBlank(this.email)) {
            return this.email;
        }
        if (!isBlank(this.slackUserId)) {
            return this.slackUserId;
        }
        return isBlank(this.callerId) ? "anonymous" : this.callerId;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
