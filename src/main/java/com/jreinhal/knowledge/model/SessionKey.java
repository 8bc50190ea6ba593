package com.jreinhal.knowledge.model;

/**
 * Storage address of a session: application, partition (user scope) and session id.
 */
public record SessionKey(String appName, String userId, String sessionId) {

    public String documentId() {
        return this.appName + ":" + this.userId + ":" + this.sessionId;
    }

    @Override
    public String toString() {
        return this.documentId();
    }
}
