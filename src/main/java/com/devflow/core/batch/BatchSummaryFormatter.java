package com.devflow.core.batch;

import com.devflow.core.model.OutputType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the plain-text report of a batch operation.
 */
public class BatchSummaryFormatter {

    private static final String RULE = "=".repeat(65);

    private final OutputFileStore store;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public BatchSummaryFormatter(OutputFileStore store, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public String format(String label, BatchOperationResult result, Map<String, ?> context) {
        StringBuilder sb = new StringBuilder();
        section(sb, "FILE OPERATION SUMMARY - " + label.toUpperCase(Locale.ROOT));
        sb.append("Timestamp: ").append(clock.instant()).append('\n');
        sb.append("Duration: ").append(result.duration()).append("ms\n");
        sb.append("Batch ID: ").append(result.batchId()).append('\n');
        sb.append("Success: ").append(result.success() ? "Yes" : "No").append('\n');
        sb.append("Files Processed: ").append(result.filesProcessed()).append('\n');
        sb.append("Errors: ").append(result.errors().size()).append('\n');

        section(sb, "FILE DETAILS");
        for (Map.Entry<OutputType, Path> entry : result.outputPaths().entrySet()) {
            OutputFileStore.FileStats stats = store.stats(entry.getValue());
            sb.append(entry.getKey().id()).append(": ").append(stats.sizeKb())
                    .append(" (").append(stats.lines()).append(" lines)\n");
        }

        if (!result.errors().isEmpty()) {
            section(sb, "ERRORS ENCOUNTERED");
            List<String> errors = result.errors();
            for (int i = 0; i < errors.size(); i++) {
                sb.append(i + 1).append(". ").append(errors.get(i)).append('\n');
            }
        }

        if (context != null && !context.isEmpty()) {
            section(sb, "ADDITIONAL CONTEXT");
            context.forEach((key, value) -> sb.append(key).append(": ").append(toJson(value)).append('\n'));
        }

        section(sb, "RECOMMENDATIONS");
        for (String line : recommendations(result.success())) {
            sb.append("- ").append(line).append('\n');
        }
        return sb.toString();
    }

    static List<String> recommendations(boolean success) {
        List<String> lines = new ArrayList<>();
        if (success) {
            lines.add("All files processed successfully");
            lines.add("Files are ready for AI analysis");
            lines.add("Consider creating a backup before major changes");
        } else {
            lines.add("Review error messages above");
            lines.add("Check file permissions and disk space");
            lines.add("Consider retrying failed operations");
        }
        return lines;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    private static void section(StringBuilder sb, String title) {
        sb.append('\n').append(RULE).append('\n').append(title).append('\n').append(RULE).append("\n\n");
    }
}
