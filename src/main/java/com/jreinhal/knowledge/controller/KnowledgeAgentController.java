package com.jreinhal.knowledge.controller;

import com.jreinhal.knowledge.dto.IngestRequest;
import com.jreinhal.knowledge.dto.IngestResponse;
import com.jreinhal.knowledge.dto.QueryRequest;
import com.jreinhal.knowledge.dto.QueryResponse;
import com.jreinhal.knowledge.filter.ApiKeyFilter;
import com.jreinhal.knowledge.model.CallerIdentity;
import com.jreinhal.knowledge.model.PendingTask;
import com.jreinhal.knowledge.reasoning.QueryTrace;
import com.jreinhal.knowledge.reasoning.QueryTracer;
import com.jreinhal.knowledge.service.QueryOrchestrationService;
import com.jreinhal.knowledge.task.BackgroundTaskRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@Tag(name = "Knowledge Agent", description = "Questions, thread ingestion and background tasks")
public class KnowledgeAgentController {
    private final QueryOrchestrationService orchestrationService;
    private final BackgroundTaskRegistry taskRegistry;
    private final QueryTracer tracer;

    public KnowledgeAgentController(QueryOrchestrationService orchestrationService, BackgroundTaskRegistry taskRegistry,
                                    QueryTracer tracer) {
        this.orchestrationService = orchestrationService;
        this.taskRegistry = taskRegistry;
        this.tracer = tracer;
    }

    @PostMapping("/query")
    @Operation(summary = "Answer a question using the thread context and long-term memory")
    public ResponseEntity<QueryResponse> query(@RequestBody QueryRequest body, HttpServletRequest request) {
        QueryResponse response = this.orchestrationService.processQuery(body, callerOf(request));
        return response.success() ? ResponseEntity.ok(response) : ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @PostMapping("/ingest-thread")
    @Operation(summary = "Save the valuable parts of a thread to long-term memory")
    public ResponseEntity<IngestResponse> ingestThread(@RequestBody IngestRequest body, HttpServletRequest request) {
        IngestResponse response = this.orchestrationService.ingestThread(body, callerOf(request));
        return response.success() ? ResponseEntity.ok(response) : ResponseEntity.unprocessableEntity().body(response);
    }

    @GetMapping("/tasks")
    @Operation(summary = "List background sub-agent tasks that are still running")
    public List<TaskView> tasks() {
        return this.taskRegistry.pendingTasks().stream().map(TaskView::of).toList();
    }

    @GetMapping("/traces/{traceId}")
    @Operation(summary = "Fetch the step trace of a recent request")
    public ResponseEntity<Map<String, Object>> trace(@PathVariable String traceId, HttpServletRequest request) {
        Optional<QueryTrace> trace = this.tracer.getTrace(traceId);
        if (trace.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Trace not found", "traceId", traceId));
        }
        CallerIdentity caller = callerOf(request);
        String owner = trace.get().getCallerId();
        if (caller != null && owner != null && !owner.equals(caller.displayId())) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "Access denied - not trace owner", "traceId", traceId));
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("traceId", trace.get().getTraceId());
        body.put("sessionId", trace.get().getSessionId());
        body.put("success", trace.get().isSuccess());
        body.put("outcome", trace.get().getOutcome());
        body.put("totalDurationMs", trace.get().getTotalDurationMs());
        body.put("steps", trace.get().getSteps());
        body.put("metrics", trace.get().getMetrics());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "UP");
        status.put("queries", this.orchestrationService.getQueryCount());
        status.put("failedQueries", this.orchestrationService.getFailedCount());
        status.put("averageLatencyMs", this.orchestrationService.getAverageLatencyMs());
        status.put("pendingTasks", this.taskRegistry.pendingTasks().size());
        status.put("shuttingDown", this.taskRegistry.isShuttingDown());
        return status;
    }

    public record TaskView(String id, String agentName, String task, String sessionId, Instant startedAt) {

        static TaskView of(PendingTask task) {
            return new TaskView(task.id(), task.agentName(), task.task(), task.sessionId(), task.startedAt());
        }
    }

    private static CallerIdentity callerOf(HttpServletRequest request) {
        Object attribute = request.getAttribute(ApiKeyFilter.IDENTITY_ATTRIBUTE);
        return attribute instanceof CallerIdentity identity ? identity : null;
    }
}
