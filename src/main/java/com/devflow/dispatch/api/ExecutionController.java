package com.devflow.dispatch.api;

import com.devflow.core.dispatch.CommandDispatcher;
import com.devflow.core.dispatch.CommandValidationException;
import com.devflow.core.model.CommandAction;
import com.devflow.core.model.CommandOptions;
import com.devflow.core.model.CommandPriority;
import com.devflow.core.model.CommandResult;
import com.devflow.core.model.QueuedCommand;
import com.devflow.core.queue.QueueAnalytics;
import com.devflow.core.queue.QueueSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the execution queue: submit, inspect, cancel, retry and stream.
 */
@RestController
@RequestMapping("/api/v1/executions")
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private final CommandDispatcher dispatcher;
    private final SseStreamingService sseStreamingService;

    public ExecutionController(CommandDispatcher dispatcher, SseStreamingService sseStreamingService) {
        this.dispatcher = dispatcher;
        this.sseStreamingService = sseStreamingService;
    }

    /**
     * POST /api/v1/executions: Validate and queue a command.
     */
    @PostMapping
    public ResponseEntity<QueuedCommand> submit(@RequestBody ExecutionRequest request) {
        var options = new CommandOptions(
                request.timeoutSeconds() == null ? 0 : request.timeoutSeconds(),
                request.extraArgs(), request.env());
        QueuedCommand queued = dispatcher.submit(request.action(), request.project(),
                CommandPriority.parse(request.priority()), options);
        log.info("Accepted {} for project {}", queued.id(), queued.project());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(queued);
    }

    /**
     * GET /api/v1/executions: Pending, active and history.
     */
    @GetMapping
    public QueueSnapshot list() {
        return dispatcher.getQueue().snapshot();
    }

    /**
     * GET /api/v1/executions/analytics: Derived statistics over the current snapshot.
     */
    @GetMapping("/analytics")
    public Map<String, Object> analytics() {
        QueueSnapshot snapshot = dispatcher.getQueue().snapshot();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", QueueAnalytics.currentStatus(snapshot));
        body.put("activeCount", snapshot.active().size());
        body.put("queueLength", snapshot.pending().size());
        body.put("historyLength", snapshot.history().size());
        body.put("successRate", QueueAnalytics.successRate(snapshot));
        body.put("averageExecutionTime", QueueAnalytics.averageExecutionTime(snapshot));
        body.put("queueByPriority", counts(QueueAnalytics.queueByPriority(snapshot)));

        Map<String, Object> byAction = new LinkedHashMap<>();
        for (Map.Entry<CommandAction, List<CommandResult>> e : QueueAnalytics.byAction(snapshot).entrySet()) {
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("count", e.getValue().size());
            stats.put("successRate", QueueAnalytics.successRateByAction(snapshot, e.getKey()));
            stats.put("averageExecutionTime", QueueAnalytics.averageExecutionTimeByAction(snapshot, e.getKey()));
            byAction.put(e.getKey().id(), stats);
        }
        body.put("byAction", byAction);
        body.put("byProject", counts(QueueAnalytics.byProject(snapshot)));
        body.put("recentActivity", QueueAnalytics.recentActivity(snapshot));
        return body;
    }

    /**
     * DELETE /api/v1/executions/{id}: Cancel a running or pending execution.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String id) {
        if (!dispatcher.cancel(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("id", id, "cancelled", true));
    }

    /**
     * DELETE /api/v1/executions: Cancel everything running and queued.
     */
    @DeleteMapping
    public List<CommandResult> cancelAll() {
        return dispatcher.cancelAll();
    }

    /**
     * POST /api/v1/executions/{id}/retry: Re-queue a failed or cancelled execution.
     */
    @PostMapping("/{id}/retry")
    public ResponseEntity<?> retry(@PathVariable String id) {
        return dispatcher.retry(id)
                .<ResponseEntity<?>>map(q -> ResponseEntity.status(HttpStatus.ACCEPTED).body(q))
                .orElseGet(() -> ResponseEntity.badRequest().body(
                        Map.of("error", "No failed execution " + id + " in history")));
    }

    @GetMapping(value = "/{id}/output", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> output(@PathVariable String id) {
        return dispatcher.getOutput(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}/output")
    public ResponseEntity<Void> clearOutput(@PathVariable String id) {
        return dispatcher.clearOutput(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    /**
     * GET /api/v1/executions/{id}/events: SSE stream of output, error, progress and complete.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String id) {
        return sseStreamingService.createEmitter(id, dispatcher.getQueue()::getFromHistory);
    }

    @ExceptionHandler(CommandValidationException.class)
    public ResponseEntity<Map<String, String>> onValidation(CommandValidationException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> onBadArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private static <K, V> Map<String, Integer> counts(Map<K, List<V>> grouped) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        grouped.forEach((k, v) -> counts.put(String.valueOf(k), v.size()));
        return counts;
    }
}
