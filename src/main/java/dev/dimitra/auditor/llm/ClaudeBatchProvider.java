package dev.dimitra.auditor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.dimitra.auditor.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic Message Batches API (/v1/messages/batches). Batch jobs are billed at half price
 * and may take up to 24 hours.
 */
public class ClaudeBatchProvider extends AbstractAuditProvider {

    private static final Logger log = LoggerFactory.getLogger(ClaudeBatchProvider.class);

    public static final String NAME = "anthropic";
    public static final String DEFAULT_MODEL = "claude-sonnet-4-5-20250929";

    private final String apiVersion;

    public ClaudeBatchProvider(String apiKey, String model, String baseUrl, String apiVersion) {
        super("ANTHROPIC_API_KEY", apiKey, model, DEFAULT_MODEL, baseUrl, "https://api.anthropic.com");
        this.apiVersion = (apiVersion == null || apiVersion.isBlank()) ? "2023-06-01" : apiVersion;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String vendor() {
        return "Claude";
    }

    @Override
    public String submit(AuditRequest request) throws IOException, InterruptedException {
        ObjectNode params = mapper.createObjectNode();
        params.put("model", model);
        params.put("max_tokens", request.maxOutputTokens());
        params.put("system", request.systemPrompt());
        ArrayNode messages = params.putArray("messages");
        messages.addObject()
                .put("role", "user")
                .put("content", AuditPrompts.userMessage(request.files(), request.decisionContext()));

        ObjectNode body = mapper.createObjectNode();
        body.putArray("requests").addObject()
                .put("custom_id", customId(request.jobLabel()))
                .set("params", params);

        HttpRequest req = authorized("/v1/messages/batches")
                .header("content-type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();

        JsonNode root = mapper.readTree(send(req).body());
        String id = root.path("id").asText("");
        if (id.isEmpty()) throw new IOException("Claude batch response has no id: " + root);
        return id;
    }

    @Override
    public PollResult poll(String jobId, String defaultFocus) throws IOException, InterruptedException {
        JsonNode batch = mapper.readTree(send(authorized("/v1/messages/batches/" + jobId).GET().build()).body());
        String status = batch.path("processing_status").asText("");
        if (!"ended".equals(status)) {
            return PollResult.processing(jobId, batch.path("request_counts").path("processing").asInt(0));
        }

        String resultsUrl = batch.path("results_url").asText(null);
        if (resultsUrl == null || resultsUrl.isBlank()) {
            log.warn("Claude batch {} ended without results", jobId);
            return PollResult.errored(jobId, Usage.NONE);
        }

        String jsonl = send(authorized(resultsUrl).GET().build()).body();
        List<Finding> findings = new ArrayList<>();
        Usage usage = Usage.NONE;
        boolean succeeded = false;
        for (String line : jsonl.split("\n")) {
            if (line.isBlank()) continue;
            JsonNode result = mapper.readTree(line).path("result");
            String type = result.path("type").asText("");
            if (!"succeeded".equals(type)) {
                log.warn("Claude batch {} request {}: {}", jobId, type, result.path("error"));
                continue;
            }
            JsonNode message = result.path("message");
            usage = usage.plus(usage(message.path("usage")));
            findings.addAll(FindingParser.parse(text(message), defaultFocus));
            succeeded = true;
        }
        return succeeded ? PollResult.succeeded(jobId, findings, usage) : PollResult.errored(jobId, usage);
    }

    private HttpRequest.Builder authorized(String path) {
        return request(path)
                .header("x-api-key", apiKey)
                .header("anthropic-version", apiVersion);
    }

    private static String text(JsonNode message) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : message.path("content")) {
            if ("text".equals(block.path("type").asText("text"))) sb.append(block.path("text").asText(""));
        }
        return sb.toString();
    }

    private static Usage usage(JsonNode u) {
        return new Usage(
                u.path("input_tokens").asLong(0),
                u.path("output_tokens").asLong(0),
                u.path("cache_read_input_tokens").asLong(0),
                u.path("cache_creation_input_tokens").asLong(0));
    }

    /** Batch custom ids allow [a-zA-Z0-9_-]{1,64}. */
    static String customId(String label) {
        String id = (label == null || label.isBlank()) ? "audit" : label.replaceAll("[^a-zA-Z0-9_-]", "_");
        return id.length() > 64 ? id.substring(0, 64) : id;
    }
}
