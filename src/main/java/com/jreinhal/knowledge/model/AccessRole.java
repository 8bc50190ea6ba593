package com.jreinhal.knowledge.model;

import java.util.Locale;

public enum AccessRole {
    WRITE("write"),
    READ("read");

    private final String value;

    AccessRole(String value) {
        this.value = value;
    }

    public String value() {
        return this.value;
    }

    /**
     * Anything other than "read" grants write; an absent role defaults to write.
     */
    public static AccessRole parse(String raw) {
        if (raw != null && READ.value.equals(raw.trim().toLowerCase(Locale.ROOT))) {
            return READ;
        }
        return WRITE;
    }
}
