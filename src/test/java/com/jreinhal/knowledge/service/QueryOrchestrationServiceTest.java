package com.jreinhal.knowledge.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.knowledge.agent.AgentRunException;
import com.jreinhal.knowledge.agent.AgentRunRequest;
import com.jreinhal.knowledge.agent.AgentRunResult;
import com.jreinhal.knowledge.agent.AgentRunner;
import com.jreinhal.knowledge.config.PermissionsProperties;
import com.jreinhal.knowledge.dto.IngestRequest;
import com.jreinhal.knowledge.dto.IngestResponse;
import com.jreinhal.knowledge.dto.QueryRequest;
import com.jreinhal.knowledge.dto.QueryResponse;
import com.jreinhal.knowledge.llm.CompletionResult;
import com.jreinhal.knowledge.llm.CompletionService;
import com.jreinhal.knowledge.llm.ContextSummarizer;
import com.jreinhal.knowledge.llm.ResponseCleaner;
import com.jreinhal.knowledge.llm.SystemPromptBuilder;
import com.jreinhal.knowledge.memory.MemoryPreSearchService;
import com.jreinhal.knowledge.memory.MemoryStore;
import com.jreinhal.knowledge.memory.MemoryStoreException;
import com.jreinhal.knowledge.model.AccessRole;
import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.model.Event;
import com.jreinhal.knowledge.model.QueryIntent;
import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.SessionKey;
import com.jreinhal.knowledge.model.TranscriptMessage;
import com.jreinhal.knowledge.reasoning.QueryTracer;
import com.jreinhal.knowledge.security.MemoryPermissionChecker;
import com.jreinhal.knowledge.session.AgentErrorClassifier;
import com.jreinhal.knowledge.session.InMemorySessionStore;
import com.jreinhal.knowledge.session.SessionCompactor;
import com.jreinhal.knowledge.session.SessionIdentityResolver;
import com.jreinhal.knowledge.session.SessionManager;
import com.jreinhal.knowledge.session.SessionRebuilder;
import com.jreinhal.knowledge.session.SessionRepairService;
import com.jreinhal.knowledge.session.ThreadMessageSyncer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class QueryOrchestrationServiceTest {
    private static final String APP = "knowledge-agent";
    private static final SessionKey THREAD_KEY = new SessionKey(APP, "C1", "thread-C1-T1");
    private static final CallerIdentity ALICE = new CallerIdentity("slack-bot", "U1", AccessRole.WRITE, "a@x.com", List.of());
    private static final String ORPHANED = "messages.4: tool_use ids were found without tool_result blocks";

    private ExecutorService executor;
    private InMemorySessionStore store;
    private MemoryStore memoryStore;
    private CompletionService completionService;
    private AgentRunner agentRunner;
    private QueryOrchestrationService service;

    @BeforeEach
    void setUp() {
        this.executor = Executors.newFixedThreadPool(2);
        this.store = new InMemorySessionStore();
        this.memoryStore = mock(MemoryStore.class);
        this.completionService = mock(CompletionService.class);
        this.agentRunner = mock(AgentRunner.class);
        when(this.memoryStore.search(anyString(), anyString(), anyInt())).thenReturn(List.of());

        Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:00:00Z"), ZoneOffset.UTC);
        SessionRebuilder rebuilder = new SessionRebuilder(this.store);
        SessionCompactor compactor = new SessionCompactor(this.store, rebuilder, this.completionService, true, 8000, 4, 5);
        PermissionsProperties permissions = new PermissionsProperties();
        permissions.setAllowedEmails(List.of(new PermissionsProperties.Entry("a@x.com", "write")));

        this.service = new QueryOrchestrationService(
                new SessionIdentityResolver(clock),
                new SessionManager(this.store),
                new ThreadMessageSyncer(this.store),
                compactor,
                new AgentErrorClassifier(),
                new SessionRepairService(rebuilder, compactor),
                new MemoryPreSearchService(this.memoryStore, this.executor, 500L, 5),
                new ContextSummarizer(this.completionService, false, 8000, 5),
                new ResponseCleaner(this.completionService, false, 200, 5),
                new SystemPromptBuilder(""),
                new MemoryPermissionChecker(permissions),
                this.agentRunner,
                new QueryTracer(Caffeine.newBuilder().maximumSize(100).build(), true),
                clock,
                APP,
                "channel");
    }

    @AfterEach
    void tearDown() {
        this.executor.shutdownNow();
    }

    private static List<TranscriptMessage> deployThread() {
        return List.of(
                new TranscriptMessage("alice", "how do we deploy?", "1.0"),
                new TranscriptMessage("bot:asst", "via script X", "2.0"),
                new TranscriptMessage("alice", "thanks", "3.0"));
    }

    private static QueryRequest threadQuery(String question) {
        return new QueryRequest(question, "", "C1", "T1", "U1", deployThread(), QueryIntent.QUERY);
    }

    private AgentRunRequest capturedRun() {
        ArgumentCaptor<AgentRunRequest> captor = ArgumentCaptor.forClass(AgentRunRequest.class);
        verify(this.agentRunner).run(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPathTest {
        @Test
        @DisplayName("Thread query syncs history into a deterministic session and answers")
        void threadQueryAnswers() {
            when(agentRunner.run(any())).thenReturn(new AgentRunResult("Use script X.", 120, 8));

            QueryResponse response = service.processQuery(threadQuery("thanks"), ALICE);

            assertThat(response.success()).isTrue();
            assertThat(response.answer()).isEqualTo("Use script X.");
            assertThat(response.sessionId()).isEqualTo("thread-C1-T1");
            Session session = store.get(THREAD_KEY).orElseThrow();
            assertThat(session.getEvents()).extracting(Event::text)
                    .containsExactly("[alice]: how do we deploy?", "via script X");
            assertThat(session.stateString(Session.STATE_LAST_SYNCED_TS)).isEqualTo("2.0");
            assertThat(service.getQueryCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Instruction carries caller, thread context and the question")
        void instructionContent() {
            when(agentRunner.run(any())).thenReturn(new AgentRunResult("ok", 0, 0));

            service.processQuery(threadQuery("what about rollback?"), ALICE);

            AgentRunRequest run = capturedRun();
            assertThat(run.caller()).isEqualTo(ALICE);
            assertThat(run.memoryUserId()).isEqualTo("C1");
            assertThat(run.instruction()).startsWith("**Date**: Monday, March 2, 2026");
            assertThat(run.instruction()).contains("**User**: a@x.com", "[1] alice: how do we deploy?");
            assertThat(run.instruction()).endsWith("what about rollback?");
        }

        @Test
        @DisplayName("Pre-search failure degrades to a run without memory context")
        void degradedPreSearch() {
            when(memoryStore.search(anyString(), anyString(), anyInt())).thenThrow(new MemoryStoreException("mongo down"));
            when(agentRunner.run(any())).thenReturn(new AgentRunResult("answer without memory", 0, 0));

            QueryResponse response = service.processQuery(threadQuery("how do we deploy?"), ALICE);

            assertThat(response.success()).isTrue();
            assertThat(capturedRun().instruction()).doesNotContain("**Memory** (pre-searched)");
        }

        @Test
        @DisplayName("A denied write is surfaced when the answer does not mention it")
        void denialSurfaced() {
            when(agentRunner.run(any())).thenAnswer(invocation -> {
                AgentRunRequest run = invocation.getArgument(0);
                run.toolLog().recordDenied("⛔ Insufficient permissions to save memory: no matching identity");
                return new AgentRunResult("Noted the deploy process.", 0, 0);
            });

            QueryResponse response = service.processQuery(threadQuery("remember this"), ALICE);

            assertThat(response.answer()).isEqualTo(
                    "Noted the deploy process.\n\n⛔ Insufficient permissions to save memory: no matching identity");
        }

        @Test
        @DisplayName("An answer already mentioning the denial is left alone")
        void denialAlreadyMentioned() {
            when(agentRunner.run(any())).thenAnswer(invocation -> {
                AgentRunRequest run = invocation.getArgument(0);
                run.toolLog().recordDenied("⛔ Insufficient permissions to save memory: no matching identity");
                return new AgentRunResult("Sorry, I could not save that. ⛔ Insufficient permissions to save memory.", 0, 0);
            });

            assertThat(service.processQuery(threadQuery("remember this"), ALICE).answer())
                    .isEqualTo("Sorry, I could not save that. ⛔ Insufficient permissions to save memory.");
        }

        @Test
        @DisplayName("An answer about unrelated permissions still gets the denial notice")
        void unrelatedPermissionWording() {
            when(agentRunner.run(any())).thenAnswer(invocation -> {
                AgentRunRequest run = invocation.getArgument(0);
                run.toolLog().recordDenied("⛔ Insufficient permissions to save memory: no matching identity");
                return new AgentRunResult("Run chmod to fix the deploy script permissions.", 0, 0);
            });

            assertThat(service.processQuery(threadQuery("remember this"), ALICE).answer()).isEqualTo(
                    "Run chmod to fix the deploy script permissions.\n\n⛔ Insufficient permissions to save memory: no matching identity");
        }

        @Test
        @DisplayName("An anonymous request after a write-capable caller stays anonymous")
        void anonymousDoesNotInheritEarlierCaller() {
            when(agentRunner.run(any())).thenReturn(new AgentRunResult("ok", 0, 0));
            CallerIdentity anonymous = new CallerIdentity(null, null, AccessRole.WRITE, null, List.of());

            service.processQuery(threadQuery("first"), ALICE);
            CompletableFuture.supplyAsync(() -> service.processQuery(threadQuery("second"), anonymous)).join();

            ArgumentCaptor<AgentRunRequest> captor = ArgumentCaptor.forClass(AgentRunRequest.class);
            verify(agentRunner, times(2)).run(captor.capture());
            AgentRunRequest second = captor.getAllValues().get(1);
            assertThat(second.caller()).isEqualTo(anonymous);
            assertThat(second.caller().email()).isNull();
            assertThat(second.instruction()).doesNotContain("a@x.com").contains("**Memory write access**: denied");
        }

        @Test
        @DisplayName("A missing caller is treated as anonymous")
        void nullCallerIsAnonymous() {
            when(agentRunner.run(any())).thenReturn(new AgentRunResult("ok", 0, 0));

            service.processQuery(threadQuery("first"), ALICE);
            service.processQuery(threadQuery("second"), null);

            ArgumentCaptor<AgentRunRequest> captor = ArgumentCaptor.forClass(AgentRunRequest.class);
            verify(agentRunner, times(2)).run(captor.capture());
            assertThat(captor.getAllValues().get(1).caller()).isEqualTo(CallerIdentity.anonymous());
        }

        @Test
        @DisplayName("Blank question fails without running the agent")
        void blankQuestion() {
            QueryResponse response = service.processQuery(threadQuery("  "), ALICE);

            assertThat(response.success()).isFalse();
            assertThat(response.message()).isEqualTo("Question must not be empty");
            verify(agentRunner, never()).run(any());
        }
    }

    @Nested
    @DisplayName("Session repair")
    class RepairTest {
        @Test
        @DisplayName("Repeated orphaned tool call errors stop after one retry")
        void orphanedRetriedOnce() {
            when(agentRunner.run(any())).thenThrow(new AgentRunException("Agent run failed", new IllegalStateException(ORPHANED)));

            QueryResponse response = service.processQuery(threadQuery("thanks"), ALICE);

            assertThat(response.success()).isFalse();
            verify(agentRunner, times(2)).run(any());
        }

        @Test
        @DisplayName("Orphaned tool call resets the session and the retry succeeds")
        void orphanedRepaired() {
            when(agentRunner.run(any()))
                    .thenThrow(new AgentRunException(ORPHANED))
                    .thenReturn(new AgentRunResult("recovered", 0, 0));

            QueryResponse response = service.processQuery(threadQuery("thanks"), ALICE);

            assertThat(response.success()).isTrue();
            assertThat(response.answer()).isEqualTo("recovered");
            Session session = store.get(THREAD_KEY).orElseThrow();
            assertThat(session.getEvents()).isEmpty();
            assertThat(session.stateString(Session.STATE_LAST_SYNCED_TS)).isEmpty();
            assertThat(service.getRepairCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Context overflow forces compaction before the retry")
        void overflowCompacts() {
            Session seeded = store.create(THREAD_KEY, Map.of(Session.STATE_LAST_SYNCED_TS, "9.0"));
            for (int i = 0; i < 20; i++) {
                store.appendEvent(seeded, i % 2 == 0 ? Event.user("user", "q" + i) : Event.model("knowledge-agent", "a" + i));
            }
            when(completionService.complete(any(), anyString(), any(Duration.class)))
                    .thenReturn(new CompletionResult("earlier questions about deploys", 0, 0));
            when(agentRunner.run(any()))
                    .thenThrow(new AgentRunException("prompt is too long: 250000 tokens > 200000 maximum"))
                    .thenReturn(new AgentRunResult("fits now", 0, 0));

            QueryResponse response = service.processQuery(threadQuery("thanks"), ALICE);

            assertThat(response.success()).isTrue();
            Session session = store.get(THREAD_KEY).orElseThrow();
            assertThat(session.getEvents()).hasSize(10);
            assertThat(session.stateString(Session.STATE_LAST_SYNCED_TS)).isEqualTo("9.0");
            verify(agentRunner, times(2)).run(any());
        }

        @Test
        @DisplayName("Unrecognized errors fail without a retry")
        void otherErrorNotRetried() {
            when(agentRunner.run(any())).thenThrow(new AgentRunException("connection reset"));

            QueryResponse response = service.processQuery(threadQuery("thanks"), ALICE);

            assertThat(response.success()).isFalse();
            assertThat(response.message()).contains("connection reset");
            verify(agentRunner, times(1)).run(any());
            assertThat(service.getFailedCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Thread ingestion")
    class IngestTest {
        @Test
        @DisplayName("Counts successful memory writes and skips session sync")
        void countsWrites() {
            when(agentRunner.run(any())).thenAnswer(invocation -> {
                AgentRunRequest run = invocation.getArgument(0);
                run.toolLog().recordWrite(true);
                run.toolLog().recordWrite(true);
                return new AgentRunResult("Saved 2 items.", 0, 0);
            });

            IngestResponse response = service.ingestThread(new IngestRequest(null, "C1", "T1", "U1", deployThread()), ALICE);

            assertThat(response.success()).isTrue();
            assertThat(response.memoriesAdded()).isEqualTo(2);
            assertThat(store.get(THREAD_KEY).orElseThrow().getEvents()).isEmpty();
            assertThat(capturedRun().instruction()).contains("[2] bot:asst: via script X")
                    .endsWith(QueryOrchestrationService.INGEST_INSTRUCTION);
        }

        @Test
        @DisplayName("Empty thread is rejected")
        void emptyThread() {
            IngestResponse response = service.ingestThread(new IngestRequest(null, "C1", "T1", "U1", List.of()), ALICE);

            assertThat(response.success()).isFalse();
            verify(agentRunner, never()).run(any());
        }

        @Test
        @DisplayName("All writes denied reports failure")
        void allDenied() {
            when(agentRunner.run(any())).thenAnswer(invocation -> {
                AgentRunRequest run = invocation.getArgument(0);
                run.toolLog().recordDenied("⛔ Insufficient permissions to save memory: no matching identity");
                return new AgentRunResult("I could not save anything.", 0, 0);
            });

            IngestResponse response = service.ingestThread(new IngestRequest(null, "C1", "T1", "U1", deployThread()), ALICE);

            assertThat(response.success()).isFalse();
            assertThat(response.memoriesAdded()).isZero();
        }
    }
}
