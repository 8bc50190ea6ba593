package com.jreinhal.knowledge.security;

import com.jreinhal.knowledge.config.PermissionsProperties;
import com.jreinhal.knowledge.model.AccessRole;
import com.jreinhal.knowledge.model.CallerIdentity;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a caller may write to long-term memory.
 *
 * <p>Rules apply in order and the first match wins: a read-only role denies; an empty
 * allow-list allows; an email entry decides by its role; the first caller group with an entry
 * decides by its role; anything else is denied. The allow-lists are fixed at startup.</p>
 */
@Component
public class MemoryPermissionChecker {
    private static final Logger log = LoggerFactory.getLogger(MemoryPermissionChecker.class);
    public static final String NO_MATCH_REASON = "no matching identity";

    private final Map<String, AccessRole> emailRoles;
    private final Map<String, AccessRole> groupRoles;

    public MemoryPermissionChecker(PermissionsProperties properties) {
        this.emailRoles = toRoleMap(properties.getAllowedEmails());
        this.groupRoles = toRoleMap(properties.getAllowedGroups());
        log.info("Memory permissions loaded: {} email entries, {} group entries", this.emailRoles.size(), this.groupRoles.size());
    }

    public boolean isEmpty() {
        return this.emailRoles.isEmpty() && this.groupRoles.isEmpty();
    }

    public PermissionDecision canWrite(CallerIdentity caller) {
        CallerIdentity identity = caller != null ? caller : CallerIdentity.anonymous();
        if (identity.isReadOnly()) {
            return PermissionDecision.deny("caller has role='read' (read-only access)");
        }
        if (this.isEmpty()) {
            return PermissionDecision.allow("no permission restrictions configured, role='write' allows write");
        }
        String email = normalize(identity.email());
        if (!email.isEmpty()) {
            AccessRole role = this.emailRoles.get(email);
            if (role != null) {
                return role == AccessRole.WRITE
                        ? PermissionDecision.allow("email '" + email + "' has write permission")
                        : PermissionDecision.deny("email '" + email + "' has read-only permission");
            }
        }
        for (String rawGroup : identity.groups()) {
            String group = normalize(rawGroup);
            AccessRole role = this.groupRoles.get(group);
            if (role != null) {
                return role == AccessRole.WRITE
                        ? PermissionDecision.allow("group '" + group + "' has write permission")
                        : PermissionDecision.deny("group '" + group + "' has read-only permission");
            }
        }
        return PermissionDecision.deny(NO_MATCH_REASON);
    }

    /**
     * Any listed entry grants read, whatever its role.
     */
    public PermissionDecision canRead(CallerIdentity caller) {
        if (this.isEmpty()) {
            return PermissionDecision.allow("no permission restrictions configured");
        }
        CallerIdentity identity = caller != null ? caller : CallerIdentity.anonymous();
        String email = normalize(identity.email());
        if (!email.isEmpty() && this.emailRoles.containsKey(email)) {
            return PermissionDecision.allow("email '" + email + "' is listed");
        }
        for (String rawGroup : identity.groups()) {
            String group = normalize(rawGroup);
            if (this.groupRoles.containsKey(group)) {
                return PermissionDecision.allow("group '" + group + "' is listed");
            }
        }
        return PermissionDecision.deny(NO_MATCH_REASON);
    }

    private static Map<String, AccessRole> toRoleMap(List<PermissionsProperties.Entry> entries) {
        Map<String, AccessRole> roles = new LinkedHashMap<>();
        if (entries == null) {
            return Collections.unmodifiableMap(roles);
        }
        for (PermissionsProperties.Entry entry : entries) {
            String value = normalize(entry.getValue());
            if (value.isEmpty()) {
                continue;
            }
            roles.putIfAbsent(value, AccessRole.parse(entry.getRole()));
        }
        return Collections.unmodifiableMap(roles);
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim();
    }
}
