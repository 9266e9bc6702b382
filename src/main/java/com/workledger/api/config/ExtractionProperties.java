package com.workledger.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the timesheet extraction job, bound from {@code extraction.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "extraction")
@Data
public class ExtractionProperties {

    /**
     * Widest allowed window between start and end date, in days.
     */
    private int maxRangeDays = 90;

    /**
     * Vendor suffix stripped from client names before matching.
     */
    private String clientSuffix = " technology consulting llc";

    /**
     * Pause between pipeline phases so pollers can observe each step.
     */
    private Duration phaseDelay = Duration.ofMillis(500);

    private Worker worker = new Worker();

    private Heartbeat heartbeat = new Heartbeat();

    private Executor executor = new Executor();

    private Recovery recovery = new Recovery();

    @Data
    public static class Worker {
        /**
         * Executable and leading arguments, e.g. ["python", "scripts/process_timesheets.py"].
         */
        private List<String> command = new ArrayList<>(List.of("python", "scripts/process_timesheets.py"));

        /**
         * Working directory of the worker process; the JVM's when empty.
         */
        private String workingDir = "";

        /**
         * Where the worker writes timesheet_results_&lt;job id&gt;.json.
         */
        private String resultsDir = "scripts";

        /**
         * Hard wall-clock bound; the process is killed after this.
         */
        private Duration timeout = Duration.ofMinutes(5);

        /**
         * Stderr kept for failure messages, in characters.
         */
        private int maxDiagnosticChars = 2000;
    }

    @Data
    public static class Heartbeat {
        private Duration interval = Duration.ofSeconds(2);
        private int step = 3;
        private int ceiling = 75;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 20;
    }

    @Data
    public static class Recovery {
        private boolean enabled = true;

        /**
         * Added to the worker timeout before a still-processing job is considered abandoned.
         */
        private Duration grace = Duration.ofMinutes(5);

        /**
         * Pause between periodic sweeps, in ISO-8601 form since the scheduler reads it too.
         */
        private Duration sweepInterval = Duration.ofMinutes(1);
    }
}
