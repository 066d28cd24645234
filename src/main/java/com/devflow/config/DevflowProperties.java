package com.devflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "devflow")
public class DevflowProperties {

    static final int MIN_CONCURRENT = 1;
    static final int MAX_CONCURRENT = 10;

    private Runner runner = new Runner();
    private Output output = new Output();
    private Batch batch = new Batch();
    /** Command line template per action id, e.g. {@code nxTest: "npx nx test {project}"}. */
    private Map<String, String> commands = new LinkedHashMap<>();

    /** Pool size, clamped to [1, 10]. */
    public int getEffectiveMaxConcurrent() {
        return Math.max(MIN_CONCURRENT, Math.min(MAX_CONCURRENT, runner.maxConcurrent));
    }

    public Runner getRunner() { return runner; }
    public void setRunner(Runner runner) { this.runner = runner; }
    public Output getOutput() { return output; }
    public void setOutput(Output output) { this.output = output; }
    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }
    public Map<String, String> getCommands() { return commands; }
    public void setCommands(Map<String, String> commands) { this.commands = commands; }

    public static class Runner {
        private int maxConcurrent = 3;
        private int timeoutSeconds = 0;
        private long gracePeriodMs = 5000;
        private long progressTickMs = 100;
        private long progressDurationMs = 30000;
        private String workingDirectory = "";

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public long getGracePeriodMs() { return gracePeriodMs; }
        public void setGracePeriodMs(long gracePeriodMs) { this.gracePeriodMs = gracePeriodMs; }
        public long getProgressTickMs() { return progressTickMs; }
        public void setProgressTickMs(long progressTickMs) { this.progressTickMs = progressTickMs; }
        public long getProgressDurationMs() { return progressDurationMs; }
        public void setProgressDurationMs(long progressDurationMs) { this.progressDurationMs = progressDurationMs; }
        public String getWorkingDirectory() { return workingDirectory; }
        public void setWorkingDirectory(String workingDirectory) { this.workingDirectory = workingDirectory; }
    }

    public static class Output {
        private String directory = ".github/instructions/ai_utilities_context";
        private String backupDirectory = ".github/instructions/backups";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
        public String getBackupDirectory() { return backupDirectory; }
        public void setBackupDirectory(String backupDirectory) { this.backupDirectory = backupDirectory; }
    }

    public static class Batch {
        private int maxRetries = 0;
        private long retryDelayMs = 100;
        private long maxAgeMinutes = 60;

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getRetryDelayMs() { return retryDelayMs; }
        public void setRetryDelayMs(long retryDelayMs) { this.retryDelayMs = retryDelayMs; }
        public long getMaxAgeMinutes() { return maxAgeMinutes; }
        public void setMaxAgeMinutes(long maxAgeMinutes) { this.maxAgeMinutes = maxAgeMinutes; }
    }
}
