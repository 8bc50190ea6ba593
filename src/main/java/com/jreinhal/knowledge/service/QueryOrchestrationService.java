package com.jreinhal.knowledge.service;

import com.jreinhal.knowledge.agent.AgentRunRequest;
import com.jreinhal.knowledge.agent.AgentRunResult;
import com.jreinhal.knowledge.agent.AgentRunner;
import com.jreinhal.knowledge.agent.ToolInvocationLog;
import com.jreinhal.knowledge.dto.IngestRequest;
import com.jreinhal.knowledge.dto.IngestResponse;
import com.jreinhal.knowledge.dto.QueryRequest;
import com.jreinhal.knowledge.dto.QueryResponse;
import com.jreinhal.knowledge.llm.ContextSummarizer;
import com.jreinhal.knowledge.llm.ResponseCleaner;
import com.jreinhal.knowledge.llm.SystemPromptBuilder;
import com.jreinhal.knowledge.llm.TranscriptFormatter;
import com.jreinhal.knowledge.memory.MemoryPreSearchService;
import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.model.QueryIntent;
import com.jreinhal.knowledge.model.Session;
import com.jreinhal.knowledge.model.SessionKey;
import com.jreinhal.knowledge.reasoning.QueryTrace;
import com.jreinhal.knowledge.reasoning.QueryTraceStep;
import com.jreinhal.knowledge.reasoning.QueryTracer;
import com.jreinhal.knowledge.security.CallerContext;
import com.jreinhal.knowledge.security.MemoryPermissionChecker;
import com.jreinhal.knowledge.security.PermissionDecision;
import com.jreinhal.knowledge.session.AgentErrorClassifier;
import com.jreinhal.knowledge.session.CompactionResult;
import com.jreinhal.knowledge.session.SessionCompactor;
import com.jreinhal.knowledge.session.SessionIdentityResolver;
import com.jreinhal.knowledge.session.SessionManager;
import com.jreinhal.knowledge.session.SessionRepairService;
import com.jreinhal.knowledge.session.ThreadMessageSyncer;
import com.jreinhal.knowledge.util.LogSanitizer;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Runs one request end to end: identity, session, thread sync, compaction, memory pre-search,
 * instruction assembly, the agent loop with a single repair retry, and answer post-processing.
 */
@Service
public class QueryOrchestrationService {
    private static final Logger log = LoggerFactory.getLogger(QueryOrchestrationService.class);
    private static final String DENIAL_MARKER = "⛔";
    static final String INGEST_INSTRUCTION = "Ingest this thread: identify the decisions, solutions, technical details and "
            + "key facts in the thread context above and store each of them with save_to_memory. "
            + "Then reply with a short list of what was saved.";

    private final SessionIdentityResolver identityResolver;
    private final SessionManager sessionManager;
    private final ThreadMessageSyncer threadMessageSyncer;
    private final SessionCompactor sessionCompactor;
    private final AgentErrorClassifier errorClassifier;
    private final SessionRepairService repairService;
    private final MemoryPreSearchService preSearchService;
    private final ContextSummarizer contextSummarizer;
    private final ResponseCleaner responseCleaner;
    private final SystemPromptBuilder promptBuilder;
    private final MemoryPermissionChecker permissionChecker;
    private final AgentRunner agentRunner;
    private final QueryTracer tracer;
    private final Clock clock;
    private final String appName;
    private final String knowledgeScope;
    private final AtomicInteger queryCount = new AtomicInteger(0);
    private final AtomicInteger failedCount = new AtomicInteger(0);
    private final AtomicInteger repairCount = new AtomicInteger(0);
    private final AtomicLong totalLatencyMs = new AtomicLong(0L);

    public QueryOrchestrationService(SessionIdentityResolver identityResolver, SessionManager sessionManager,
                                     ThreadMessageSyncer threadMessageSyncer, SessionCompactor sessionCompactor,
                                     AgentErrorClassifier errorClassifier, SessionRepairService repairService,
                                     MemoryPreSearchService preSearchService, ContextSummarizer contextSummarizer,
                                     ResponseCleaner responseCleaner, SystemPromptBuilder promptBuilder,
                                     MemoryPermissionChecker permissionChecker, AgentRunner agentRunner,
                                     QueryTracer tracer, Clock clock,
                                     @Value("${knowledge.app-name:knowledge-agent}") String appName,
                                     @Value("${knowledge.scope:shared}") String knowledgeScope) {
        this.identityResolver = identityResolver;
        this.sessionManager = sessionManager;
        this.threadMessageSyncer = threadMessageSyncer;
        this.sessionCompactor = sessionCompactor;
        this.errorClassifier = errorClassifier;
        this.repairService = repairService;
        this.preSearchService = preSearchService;
        this.contextSummarizer = contextSummarizer;
        this.responseCleaner = responseCleaner;
        this.promptBuilder = promptBuilder;
        this.permissionChecker = permissionChecker;
        this.agentRunner = agentRunner;
        this.tracer = tracer;
        this.clock = clock;
        this.appName = appName;
        this.knowledgeScope = knowledgeScope;
    }

    public QueryResponse processQuery(QueryRequest request, CallerIdentity explicitCaller) {
        return this.execute(request, explicitCaller, new ToolInvocationLog());
    }

    /**
     * Stores the useful parts of a thread; the agent decides what to save.
     */
    public IngestResponse ingestThread(IngestRequest request, CallerIdentity explicitCaller) {
        if (request.transcript().isEmpty()) {
            return new IngestResponse(false, "Thread has no messages to ingest", 0, request.sessionId());
        }
        QueryRequest query = new QueryRequest(INGEST_INSTRUCTION, request.sessionId(), request.channelId(), request.threadTs(),
                request.slackUserId(), request.transcript(), QueryIntent.INGEST);
        ToolInvocationLog toolLog = new ToolInvocationLog();
        QueryResponse response = this.execute(query, explicitCaller, toolLog);
        if (!response.success()) {
            return new IngestResponse(false, response.message(), toolLog.successfulWrites(), response.sessionId());
        }
        if (toolLog.hasDenials() && toolLog.successfulWrites() == 0) {
            return new IngestResponse(false, response.answer(), 0, response.sessionId());
        }
        return new IngestResponse(true, response.answer(), toolLog.successfulWrites(), response.sessionId());
    }

    private QueryResponse execute(QueryRequest request, CallerIdentity explicitCaller, ToolInvocationLog toolLog) {
        long start = System.currentTimeMillis();
        CallerIdentity caller = explicitCaller != null ? explicitCaller : CallerIdentity.anonymous();
        CallerContext.bind(caller);

        String sessionId = this.identityResolver.resolveSessionId(request.sessionId(), request.channelId(), request.threadTs());
        String slackUserId = request.slackUserId() != null ? request.slackUserId() : caller.slackUserId();
        String userId = this.identityResolver.resolveUserId(this.knowledgeScope, request.channelId(), slackUserId);
        SessionKey key = new SessionKey(this.appName, userId, sessionId);
        QueryTrace trace = this.tracer.startTrace(sessionId, userId, caller.displayId());
        this.tracer.addStep(trace, QueryTraceStep.StepType.IDENTITY, "Resolved identity", "session=" + sessionId + " partition=" + userId, 0L);

        try {
            if (request.question() == null || request.question().isBlank()) {
                throw new IllegalArgumentException("Question must not be empty");
            }
            PermissionDecision writePermission = this.permissionChecker.canWrite(caller);
            log.info("Processing {} for caller {} in session {} (memory write: {}, {})", request.intent(),
                    LogSanitizer.sanitize(caller.displayId()), LogSanitizer.sanitize(sessionId),
                    writePermission.allowed(), writePermission.reason());

            Session session = this.tracer.timed(trace, QueryTraceStep.StepType.SESSION, "Get or create session",
                    () -> this.sessionManager.getOrCreate(key));

            if (request.intent() != QueryIntent.INGEST) {
                int synced = this.tracer.timed(trace, QueryTraceStep.StepType.THREAD_SYNC, "Sync thread messages",
                        () -> this.threadMessageSyncer.sync(session, request.transcript()));
                trace.addMetric("syncedEvents", synced);
            }

            String threadContext = this.tracer.timed(trace, QueryTraceStep.StepType.CONTEXT_SUMMARY, "Prepare thread context",
                    () -> this.contextSummarizer.summarize(TranscriptFormatter.format(request.transcript())));

            this.compactQuietly(key, trace);

            String preSearch = this.tracer.timed(trace, QueryTraceStep.StepType.PRE_SEARCH, "Pre-search memory",
                    () -> this.preSearchService.preSearch(request.intent() == QueryIntent.INGEST ? null : request.question(), userId));

            String instruction = this.promptBuilder.buildInstruction(new SystemPromptBuilder.InstructionContext(
                    LocalDate.now(this.clock), caller.email(), writePermission, preSearch, threadContext, request.question()));

            AgentRunRequest runRequest = new AgentRunRequest(key, instruction, caller, userId,
                    request.channelId(), request.threadTs(), toolLog);
            AgentRunResult result = this.runWithRepair(runRequest, trace);
            trace.addMetric("promptTokens", result.promptTokens());
            trace.addMetric("completionTokens", result.completionTokens());

            String rawAnswer = withDenialNotice(result.answer(), toolLog);
            String answer = this.tracer.timed(trace, QueryTraceStep.StepType.RESPONSE_CLEANUP, "Clean response",
                    () -> this.responseCleaner.clean(rawAnswer));

            long latency = this.recordLatency(start);
            this.tracer.endTrace(trace, true, null);
            log.info("Query completed in {}ms for session {} (answer {})", latency, LogSanitizer.sanitize(sessionId),
                    LogSanitizer.textSummary(answer));
            return QueryResponse.ok(answer, sessionId, trace.getTraceId());
        }
        catch (RuntimeException e) {
            this.failedCount.incrementAndGet();
            long latency = this.recordLatency(start);
            this.tracer.endTrace(trace, false, e.getMessage());
            if (e instanceof IllegalArgumentException) {
                log.warn("Rejected query for session {}: {}", LogSanitizer.sanitize(sessionId), e.getMessage());
            }
            else {
                log.error("Query failed after {}ms for session {}", latency, LogSanitizer.sanitize(sessionId), e);
            }
            return QueryResponse.failed(userMessage(e), sessionId, trace.getTraceId());
        }
        finally {
            CallerContext.clear();
        }
    }

    /**
     * Runs the agent; on an orphaned tool call or a context overflow repairs the session and
     * retries exactly once. Any other error, or a failing retry, propagates.
     */
    AgentRunResult runWithRepair(AgentRunRequest runRequest, QueryTrace trace) {
        long start = System.currentTimeMillis();
        try {
            AgentRunResult result = this.agentRunner.run(runRequest);
            this.tracer.addStep(trace, QueryTraceStep.StepType.AGENT_RUN, "Agent run", null, System.currentTimeMillis() - start);
            return result;
        }
        catch (RuntimeException e) {
            AgentErrorClassifier.ErrorKind kind = this.errorClassifier.classify(e);
            this.tracer.addStep(trace, QueryTraceStep.StepType.ERROR, "Agent run failed", kind + ": " + e.getMessage(),
                    System.currentTimeMillis() - start);
            switch (kind) {
                case ORPHANED_TOOL_CALL -> this.repairService.discardCorrupted(runRequest.sessionKey());
                case CONTEXT_OVERFLOW -> this.repairService.recoverFromOverflow(runRequest.sessionKey());
                default -> throw e;
            }
            this.repairCount.incrementAndGet();
            this.tracer.addStep(trace, QueryTraceStep.StepType.SESSION_REPAIR, "Repaired session", kind.name(), 0L);
        }
        long retryStart = System.currentTimeMillis();
        AgentRunResult retried = this.agentRunner.run(runRequest);
        this.tracer.addStep(trace, QueryTraceStep.StepType.AGENT_RUN, "Agent run (retry)", null, System.currentTimeMillis() - retryStart);
        return retried;
    }

    private void compactQuietly(SessionKey key, QueryTrace trace) {
        long start = System.currentTimeMillis();
        try {
            CompactionResult result = this.sessionCompactor.compactIfNeeded(key);
            if (result.compacted()) {
                this.tracer.addStep(trace, QueryTraceStep.StepType.COMPACTION, "Compacted session",
                        result.eventsBefore() + " -> " + result.eventsAfter() + " events", System.currentTimeMillis() - start,
                        Map.of("tokensBefore", result.tokensBefore(), "tokensAfter", result.tokensAfter()));
            }
        }
        catch (RuntimeException e) {
            log.warn("Session compaction failed for {}: {}", key, e.getMessage());
            this.tracer.addStep(trace, QueryTraceStep.StepType.ERROR, "Compaction skipped", e.getMessage(), System.currentTimeMillis() - start);
        }
    }

    static String withDenialNotice(String answer, ToolInvocationLog toolLog) {
        if (!toolLog.hasDenials()) {
            return answer;
        }
        String text = answer == null ? "" : answer;
        if (text.contains(DENIAL_MARKER) || mentionsDenial(text, toolLog)) {
            return text;
        }
        String notice = toolLog.deniedReasons().get(0);
        return text.isBlank() ? notice : text + "\n\n" + notice;
    }

    private static boolean mentionsDenial(String answer, ToolInvocationLog toolLog) {
        String lower = answer.toLowerCase(Locale.ROOT);
        for (String reason : toolLog.deniedReasons()) {
            String bare = reason.replace(DENIAL_MARKER, "").strip().toLowerCase(Locale.ROOT);
            if (!bare.isEmpty() && lower.contains(bare)) {
                return true;
            }
        }
        return false;
    }

    private static String userMessage(RuntimeException e) {
        if (e instanceof IllegalArgumentException) {
            return e.getMessage();
        }
        return "Failed to process query: " + LogSanitizer.preview(e.getMessage(), 200);
    }

    private long recordLatency(long start) {
        long latency = System.currentTimeMillis() - start;
        this.queryCount.incrementAndGet();
        this.totalLatencyMs.addAndGet(latency);
        return latency;
    }

    public int getQueryCount() {
        return this.queryCount.get();
    }

    public int getFailedCount() {
        return this.failedCount.get();
    }

    public int getRepairCount() {
        return this.repairCount.get();
    }

    public long getAverageLatencyMs() {
        int count = this.queryCount.get();
        return count == 0 ? 0L : this.totalLatencyMs.get() / count;
    }
}
