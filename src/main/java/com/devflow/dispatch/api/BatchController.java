package com.devflow.dispatch.api;

import com.devflow.config.DevflowProperties;
import com.devflow.core.batch.BatchCoordinator;
import com.devflow.core.batch.BatchOperationResult;
import com.devflow.core.batch.BatchOptions;
import com.devflow.core.batch.BatchRecord;
import com.devflow.core.batch.OutputFile;
import com.devflow.core.batch.OutputValidation;
import com.devflow.core.model.OutputType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller for batch writes of generated output files and their validation.
 */
@RestController
@RequestMapping("/api/v1/batches")
public class BatchController {

    private final BatchCoordinator batchCoordinator;
    private final int defaultMaxRetries;

    public BatchController(BatchCoordinator batchCoordinator,
                           DevflowProperties properties) {
        this.batchCoordinator = batchCoordinator;
        this.defaultMaxRetries = properties.getBatch().getMaxRetries();
    }

    /**
     * POST /api/v1/batches: Write a set of output files as one batch.
     */
    @PostMapping
    public ResponseEntity<?> executeBatch(@RequestBody BatchRequest request) {
        if (request.label() == null || request.label().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Label is required"));
        }
        if (request.files() == null || request.files().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "At least one file is required"));
        }
        List<OutputFile> files = new ArrayList<>();
        for (BatchRequest.FileEntry entry : request.files()) {
            Optional<OutputType> type = OutputType.fromId(entry.type());
            if (type.isEmpty()) {
                return ResponseEntity.badRequest().body(Map.of("error", "Unknown output type: " + entry.type()));
            }
            files.add(new OutputFile(type.get(), entry.content()));
        }
        int retries = request.maxRetries() != null ? request.maxRetries() : defaultMaxRetries;
        var options = new BatchOptions(request.createBackup(), request.validateContent(),
                request.notifyUser(), request.trackHistory(), retries);

        BatchOperationResult result = batchCoordinator.executeBatch(request.label(), files, options);
        return ResponseEntity.ok(toBody(result));
    }

    /**
     * GET /api/v1/batches/validation?types=diff,jest-output: Classify output files on disk.
     */
    @GetMapping("/validation")
    public ResponseEntity<?> validate(@RequestParam(name = "types", required = false) List<String> types) {
        List<OutputType> expected = new ArrayList<>();
        if (types == null || types.isEmpty()) {
            expected.addAll(Arrays.asList(OutputType.values()));
        } else {
            for (String t : types) {
                Optional<OutputType> type = OutputType.fromId(t);
                if (type.isEmpty()) {
                    return ResponseEntity.badRequest().body(Map.of("error", "Unknown output type: " + t));
                }
                expected.add(type.get());
            }
        }
        OutputValidation validation = batchCoordinator.validateCommandOutputs(expected);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", validation.valid().stream().map(OutputType::id).toList());
        body.put("missing", validation.missing().stream().map(OutputType::id).toList());
        body.put("corrupt", validation.corrupt().stream().map(OutputType::id).toList());
        return ResponseEntity.ok(body);
    }

    @GetMapping
    public Map<String, BatchRecord> activeBatches() {
        batchCoordinator.cleanupCompletedBatches();
        return batchCoordinator.getActiveBatches();
    }

    @GetMapping("/{id}")
    public ResponseEntity<BatchRecord> batch(@PathVariable String id) {
        return batchCoordinator.getBatch(id)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    static Map<String, Object> toBody(BatchOperationResult result) {
        Map<String, String> paths = new LinkedHashMap<>();
        result.outputPaths().forEach((type, path) -> paths.put(type.id(), path.toString()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("batchId", result.batchId());
        body.put("success", result.success());
        body.put("filesProcessed", result.filesProcessed());
        body.put("errors", result.errors());
        body.put("duration", result.duration());
        body.put("outputPaths", paths);
        return body;
    }
}
