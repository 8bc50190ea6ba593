package com.jreinhal.knowledge.agent;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.jreinhal.knowledge.config.PermissionsProperties;
import com.jreinhal.knowledge.memory.MemoryStore;
import com.jreinhal.knowledge.memory.MemoryStoreException;
import com.jreinhal.knowledge.memory.PermissionGatedMemoryStore;
import com.jreinhal.knowledge.model.AccessRole;
import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.model.MemoryEntry;
import com.jreinhal.knowledge.security.MemoryPermissionChecker;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ToolContext;

class MemoryToolsTest {
    private static final CallerIdentity WRITER = new CallerIdentity("bot", "U1", AccessRole.WRITE, "a@x.com", List.of());
    private static final CallerIdentity READER = new CallerIdentity("bot", "U2", AccessRole.READ, "a@x.com", List.of());

    private MemoryStore delegate;
    private MemoryTools tools;
    private ToolInvocationLog toolLog;

    @BeforeEach
    void setUp() {
        this.delegate = mock(MemoryStore.class);
        PermissionsProperties properties = new PermissionsProperties();
        properties.setAllowedEmails(List.of(new PermissionsProperties.Entry("a@x.com", "write")));
        this.tools = new MemoryTools(new PermissionGatedMemoryStore(this.delegate, new MemoryPermissionChecker(properties)));
        this.toolLog = new ToolInvocationLog();
    }

    private ToolContext context(CallerIdentity caller) {
        return new ToolContext(Map.of(
                ToolContextKeys.CALLER, caller,
                ToolContextKeys.MEMORY_USER_ID, "C1",
                ToolContextKeys.TOOL_LOG, this.toolLog));
    }

    private static MemoryEntry entry(String id, String content) {
        return new MemoryEntry(id, "C1", content, Map.of(), 0.87, Instant.now(), Instant.now());
    }

    @Nested
    @DisplayName("Writes")
    class WriteTest {
        @Test
        @DisplayName("Permitted save is stored in the caller's partition and counted")
        void permittedSave() {
            when(delegate.add(eq("C1"), eq("deploy via script X"), anyMap())).thenReturn(entry("m1", "deploy via script X"));

            String result = tools.saveToMemory("deploy via script X", context(WRITER));

            assertThat(result).isEqualTo("Saved to memory with id m1");
            assertThat(toolLog.successfulWrites()).isEqualTo(1);
            assertThat(toolLog.hasDenials()).isFalse();
        }

        @Test
        @DisplayName("Denied save returns a readable refusal and is logged")
        void deniedSave() {
            String result = tools.saveToMemory("secret", context(READER));

            assertThat(result).startsWith("⛔ Insufficient permissions to save memory: caller has role='read'");
            assertThat(toolLog.deniedReasons()).hasSize(1);
            assertThat(toolLog.successfulWrites()).isZero();
        }

        @Test
        @DisplayName("Store failure is reported as an error and counted as failed")
        void storeFailure() {
            when(delegate.update("C1", "m9", "new")).thenThrow(new MemoryStoreException("Memory not found: m9"));

            String result = tools.updateMemory("m9", "new", context(WRITER));

            assertThat(result).startsWith("Error: update memory failed");
            assertThat(toolLog.failedWrites()).isEqualTo(1);
        }

        @Test
        @DisplayName("Delete by a reader is denied")
        void deniedDelete() {
            assertThat(tools.deleteMemory("m1", context(READER))).startsWith("⛔ ");
            assertThat(toolLog.hasDenials()).isTrue();
        }
    }

    @Nested
    @DisplayName("Search")
    class SearchTest {
        @Test
        @DisplayName("Results list id, score and content")
        void listsResults() {
            when(delegate.search("C1", "deploy", 10)).thenReturn(List.of(entry("m1", "deploy via script X")));

            assertThat(tools.searchMemory("deploy", context(READER))).isEqualTo("- id=m1 score=0.87: deploy via script X\n");
        }

        @Test
        @DisplayName("Missing context searches the shared partition")
        void missingContext() {
            when(delegate.search(anyString(), anyString(), anyInt())).thenReturn(List.of());

            assertThat(tools.searchMemory("deploy", null)).isEqualTo("No relevant memories found.");
            assertThat(MemoryTools.memoryUserId(null)).isEqualTo("shared-knowledge");
        }
    }
}
