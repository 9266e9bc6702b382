package com.workledger.api.worker;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workledger.api.config.ExtractionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessExtractionWorkerTest {

    // Reads the request from stdin and derives the result file from results_id
    private static final String READ_REQUEST = """
            request=$(cat)
            id=$(printf '%s' "$request" | sed -n 's/.*"results_id":"\\([^"]*\\)".*/\\1/p')
            out="$EXTRACTION_RESULTS_DIR/timesheet_results_$id.json"
            """;

    @TempDir
    Path tempDir;

    private ExtractionProperties properties;
    private UUID jobId;

    @BeforeEach
    void setUp() {
        properties = new ExtractionProperties();
        properties.getWorker().setResultsDir(tempDir.resolve("results").toString());
        properties.getWorker().setTimeout(Duration.ofSeconds(20));
        jobId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Rows in the result file resolve as success")
    void successFromResultFile() throws IOException {
        // given
        ProcessExtractionWorker worker = workerRunning(READ_REQUEST + """
                cat > "$out" <<'JSON'
                {"success": true, "extracted_data": [{"date": "2024-05-06", "day": "Monday", "hours": 8,
                  "client": "Acme", "sender_email": "alice@example.com", "activity": "WORK", "extra": "ignored"}]}
                JSON
                exit 0
                """);

        // when
        WorkerResult result = worker.run(request());

        // then
        assertThat(result.success()).isTrue();
        assertThat(result.extractedData()).hasSize(1);
        assertThat(result.extractedData().get(0).senderEmail()).isEqualTo("alice@example.com");
        assertThat(result.extractedData().get(0).hours()).isEqualByComparingTo("8");
    }

    @Test
    @DisplayName("The result file is authoritative over a non-zero exit code")
    void resultFileWinsOverExitCode() throws IOException {
        ProcessExtractionWorker worker = workerRunning(READ_REQUEST + """
                echo '{"success": true, "extracted_data": []}' > "$out"
                exit 2
                """);

        WorkerResult result = worker.run(request());

        assertThat(result.success()).isTrue();
        assertThat(result.extractedData()).isEmpty();
    }

    @Test
    @DisplayName("A reported failure carries the worker's message")
    void reportedFailure() throws IOException {
        ProcessExtractionWorker worker = workerRunning(READ_REQUEST + """
                echo '{"success": false, "message": "IMAP login failed", "errors": ["auth"]}' > "$out"
                exit 1
                """);

        WorkerResult result = worker.run(request());

        assertThat(result.outcome()).isEqualTo(WorkerResult.Outcome.FAILED);
        assertThat(result.message()).isEqualTo("IMAP login failed");
        assertThat(result.errors()).contains("auth");
    }

    @Test
    @DisplayName("A failure without a message falls back to the exit code")
    void failureWithoutMessage() throws IOException {
        ProcessExtractionWorker worker = workerRunning(READ_REQUEST + """
                echo '{"success": false}' > "$out"
                exit 4
                """);

        WorkerResult result = worker.run(request());

        assertThat(result.message()).isEqualTo("Worker process failed with code 4");
    }

    @Test
    @DisplayName("Invalid JSON in the result file is a failure")
    void invalidJson() throws IOException {
        ProcessExtractionWorker worker = workerRunning(READ_REQUEST + """
                echo 'not json at all' > "$out"
                exit 0
                """);

        WorkerResult result = worker.run(request());

        assertThat(result.outcome()).isEqualTo(WorkerResult.Outcome.FAILED);
        assertThat(result.message()).isEqualTo("Worker completed but results file couldn't be read. Exit code: 0");
    }

    @Test
    @DisplayName("A missing result file fails with the captured stderr")
    void missingFileIncludesStderr() throws IOException {
        ProcessExtractionWorker worker = workerRunning("""
                cat > /dev/null
                echo 'Traceback: mailbox unreachable' >&2
                exit 3
                """);

        WorkerResult result = worker.run(request());

        assertThat(result.outcome()).isEqualTo(WorkerResult.Outcome.FAILED);
        assertThat(result.message()).endsWith("Exit code: 3");
        assertThat(result.errors()).anySatisfy(error -> assertThat(error).contains("mailbox unreachable"));
    }

    @Test
    @DisplayName("A worker that outlives the timeout is killed and reported as timed out")
    void timeoutKillsWorker() throws IOException {
        // given
        properties.getWorker().setTimeout(Duration.ofMillis(300));
        ProcessExtractionWorker worker = workerRunning("sleep 30\n");
        long started = System.nanoTime();

        // when
        WorkerResult result = worker.run(request());

        // then
        assertThat(result.outcome()).isEqualTo(WorkerResult.Outcome.TIMED_OUT);
        assertThat(result.message()).contains("timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(15));
    }

    @Test
    @DisplayName("A worker that cannot be started is a failure, not an exception")
    void unstartableWorker() {
        properties.getWorker().setCommand(List.of(tempDir.resolve("does-not-exist").toString()));
        ProcessExtractionWorker worker = new ProcessExtractionWorker(properties, new ObjectMapper());

        WorkerResult result = worker.run(request());

        assertThat(result.outcome()).isEqualTo(WorkerResult.Outcome.FAILED);
        assertThat(result.message()).startsWith("Failed to execute extraction worker");
    }

    @Test
    @DisplayName("Discarding the result file tolerates it being gone already")
    void discardIsIdempotent() throws IOException {
        // given
        ProcessExtractionWorker worker = new ProcessExtractionWorker(properties, new ObjectMapper());
        Path file = worker.resultFile(jobId);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "{}");

        // when / then
        assertThat(worker.discardResult(jobId)).isTrue();
        assertThat(file).doesNotExist();
        assertThat(worker.discardResult(jobId)).isFalse();
    }

    private ProcessExtractionWorker workerRunning(String script) throws IOException {
        Path scriptFile = tempDir.resolve("worker.sh");
        Files.writeString(scriptFile, script);
        properties.getWorker().setCommand(List.of("sh", scriptFile.toString()));
        return new ProcessExtractionWorker(properties, new ObjectMapper());
    }

    private WorkerRequest request() {
        return new WorkerRequest("inbox@example.com", "app-password", null, Map.of(), jobId,
                "2024-05-01", "2024-05-31");
    }
}
