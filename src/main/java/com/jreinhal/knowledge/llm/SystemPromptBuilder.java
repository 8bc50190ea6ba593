package com.jreinhal.knowledge.llm;

import com.jreinhal.knowledge.security.PermissionDecision;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Builds the system prompt and the per-request instruction handed to the agent loop.
 */
@Component
public class SystemPromptBuilder {
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.ENGLISH);

    private final String systemPrompt;

    public SystemPromptBuilder(@Value("${knowledge.agent-name:}") String agentName) {
        this.systemPrompt = personalize(PromptTemplates.SYSTEM_PROMPT, agentName);
    }

    public String systemPrompt() {
        return this.systemPrompt;
    }

    static String personalize(String basePrompt, String agentName) {
        if (agentName == null || agentName.isBlank() || "Knowledge Agent".equals(agentName)) {
            return basePrompt;
        }
        int at = basePrompt.indexOf(PromptTemplates.DEFAULT_AGENT_INTRO);
        if (at < 0) {
            return basePrompt;
        }
        return basePrompt.substring(0, at) + "You are " + agentName.trim() + ", a Knowledge Management Assistant"
                + basePrompt.substring(at + PromptTemplates.DEFAULT_AGENT_INTRO.length());
    }

    /**
     * Assembles date, caller, permission context, pre-searched memory, thread history and the
     * question into one user turn. Blank sections are omitted.
     */
    public String buildInstruction(InstructionContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("**Date**: ").append(DATE_FORMAT.format(context.date()));
        if (hasText(context.userEmail())) {
            sb.append("\n**User**: ").append(context.userEmail());
        }
        PermissionDecision permission = context.writePermission();
        if (permission != null && !permission.allowed()) {
            sb.append("\n**Memory write access**: denied (").append(permission.reason())
                    .append("). Tell the user if they ask you to save, update or delete memories.");
        }
        if (hasText(context.preSearchResults())) {
            sb.append("\n\n**Memory** (pre-searched):\n").append(context.preSearchResults().strip());
        }
        if (hasText(context.threadContext())) {
            sb.append("\n\n**Thread context**:\n").append(context.threadContext().strip());
        }
        sb.append("\n\n").append(context.question() == null ? "" : context.question());
        return sb.toString();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public record InstructionContext(LocalDate date, String userEmail, PermissionDecision writePermission,
                                     String preSearchResults, String threadContext, String question) {
    }
}
