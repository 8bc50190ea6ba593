package com.jreinhal.knowledge.llm;

import static org.assertj.core.api.Assertions.assertThat;

import com.jreinhal.knowledge.model.TranscriptMessage;
import com.jreinhal.knowledge.security.PermissionDecision;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SystemPromptBuilderTest {

    @Test
    @DisplayName("Agent name replaces the default introduction")
    void personalizes() {
        SystemPromptBuilder builder = new SystemPromptBuilder("Atlas");

        assertThat(builder.systemPrompt()).contains("You are Atlas, a Knowledge Management Assistant");
        assertThat(builder.systemPrompt()).doesNotContain(PromptTemplates.DEFAULT_AGENT_INTRO);
    }

    @Test
    @DisplayName("Blank agent name keeps the default prompt")
    void defaultPrompt() {
        assertThat(new SystemPromptBuilder("").systemPrompt()).isEqualTo(PromptTemplates.SYSTEM_PROMPT);
        assertThat(SystemPromptBuilder.personalize(PromptTemplates.SYSTEM_PROMPT, "$1 agent"))
                .contains("You are $1 agent, a Knowledge Management Assistant");
    }

    @Test
    @DisplayName("Instruction carries date, user, denial, memory, thread and question")
    void buildsInstruction() {
        String instruction = new SystemPromptBuilder("").buildInstruction(new SystemPromptBuilder.InstructionContext(
                LocalDate.of(2026, 3, 2), "a@x.com", PermissionDecision.deny("no matching identity"),
                "1. deploy via script X\n", "[1] alice: how do we deploy?\n", "how do we deploy?"));

        assertThat(instruction).startsWith("**Date**: Monday, March 2, 2026");
        assertThat(instruction).contains("**User**: a@x.com");
        assertThat(instruction).contains("denied (no matching identity)");
        assertThat(instruction).contains("1. deploy via script X");
        assertThat(instruction).contains("[1] alice: how do we deploy?");
        assertThat(instruction).endsWith("how do we deploy?");
    }

    @Test
    @DisplayName("Empty sections are omitted")
    void omitsEmptySections() {
        String instruction = new SystemPromptBuilder("").buildInstruction(new SystemPromptBuilder.InstructionContext(
                LocalDate.of(2026, 3, 2), null, PermissionDecision.allow("ok"), "", null, "hi"));

        assertThat(instruction).doesNotContain("**User**", "**Memory**", "**Thread context**", "denied");
    }

    @Test
    @DisplayName("Transcript lines are numbered with readable UTC times")
    void formatsTranscript() {
        String formatted = TranscriptFormatter.format(List.of(
                new TranscriptMessage("alice", "how do we deploy?", "1700000000.000100"),
                new TranscriptMessage("bob", "Bob", "see doc", null, List.of("img.png"))));

        assertThat(formatted).contains("[1] alice: how do we deploy?\n   (time: 2023-11-14 22:13:20 UTC)");
        assertThat(formatted).contains("[2] Bob: see doc\n   Attached 1 image(s)");
        assertThat(TranscriptFormatter.formatTimestamp("not-a-ts")).isEqualTo("not-a-ts");
    }
}
