package dev.dimitra.auditor.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Base for vendors without a batch endpoint. {@code submit} makes the blocking call and keeps
 * the raw answer under a generated job id; {@code poll} reports it as ended. With a results
 * directory set, answers are also written to {@code <dir>/<jobId>.json} so that a later process
 * can poll them. Without one, a job id from another process polls as errored.
 */
public abstract class SynchronousAuditProvider extends AbstractAuditProvider {

    private static final Logger log = LoggerFactory.getLogger(SynchronousAuditProvider.class);

    public record Completion(String text, Usage usage) {}

    private final Map<String, Completion> completed = new ConcurrentHashMap<>();
    private Path resultsDir;

    protected SynchronousAuditProvider(String apiKeyEnv, String apiKey, String model, String defaultModel,
                                       String baseUrl, String defaultBaseUrl) {
        super(apiKeyEnv, apiKey, model, defaultModel, baseUrl, defaultBaseUrl);
    }

    public void persistTo(Path resultsDir) {
        this.resultsDir = resultsDir;
    }

    /** One blocking request to the vendor. */
    protected abstract Completion complete(AuditRequest request) throws IOException, InterruptedException;

    @Override
    public String submit(AuditRequest request) throws IOException, InterruptedException {
        Completion completion = complete(request);
        String jobId = name() + "-" + UUID.randomUUID();
        completed.put(jobId, completion);
        if (resultsDir != null) write(jobId, completion);
        return jobId;
    }

    @Override
    public PollResult poll(String jobId, String defaultFocus) throws IOException {
        Completion completion = completed.get(jobId);
        if (completion == null) completion = read(jobId);
        if (completion == null) {
            log.warn("{} job {} has no stored answer; it is not recoverable", name(), jobId);
            return PollResult.errored(jobId, Usage.NONE);
        }
        return PollResult.succeeded(jobId, FindingParser.parse(completion.text(), defaultFocus), completion.usage());
    }

    @Override
    public PollResult runToCompletion(AuditRequest request, String defaultFocus)
            throws IOException, InterruptedException {
        return poll(submit(request), defaultFocus);
    }

    private Path resultPath(String jobId) {
        return resultsDir.resolve(jobId + ".json");
    }

    private void write(String jobId, Completion completion) throws IOException {
        ObjectNode node = mapper.createObjectNode();
        node.put("job_id", jobId);
        node.put("text", completion.text());
        node.putObject("usage")
                .put("input_tokens", completion.usage().inputTokens())
                .put("output_tokens", completion.usage().outputTokens())
                .put("cache_read_tokens", completion.usage().cacheReadTokens())
                .put("cache_write_tokens", completion.usage().cacheWriteTokens());
        Files.createDirectories(resultsDir);
        Files.writeString(resultPath(jobId), mapper.writeValueAsString(node), StandardCharsets.UTF_8);
    }

    private Completion read(String jobId) throws IOException {
        if (resultsDir == null || !Files.isRegularFile(resultPath(jobId))) return null;
        JsonNode node = mapper.readTree(Files.readString(resultPath(jobId), StandardCharsets.UTF_8));
        JsonNode u = node.path("usage");
        return new Completion(node.path("text").asText(""), new Usage(
                u.path("input_tokens").asLong(0),
                u.path("output_tokens").asLong(0),
                u.path("cache_read_tokens").asLong(0),
                u.path("cache_write_tokens").asLong(0)));
    }
}
