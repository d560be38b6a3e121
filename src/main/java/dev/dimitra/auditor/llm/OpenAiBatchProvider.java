package dev.dimitra.auditor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.dimitra.auditor.model.Finding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * OpenAI Batch API: the chat completion request is uploaded as a JSONL file, a batch is
 * created over it, and the output file is downloaded once the batch is terminal.
 */
public class OpenAiBatchProvider extends AbstractAuditProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiBatchProvider.class);

    public static final String NAME = "openai";
    public static final String DEFAULT_MODEL = "gpt-4.1";

    private static final Set<String> TERMINAL = Set.of("completed", "failed", "expired", "cancelled");

    public OpenAiBatchProvider(String apiKey, String model, String baseUrl) {
        super("OPENAI_API_KEY", apiKey, model, DEFAULT_MODEL, baseUrl, "https://api.openai.com");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String vendor() {
        return "OpenAI";
    }

    @Override
    public String submit(AuditRequest request) throws IOException, InterruptedException {
        String fileId = upload(batchLine(request));

        ObjectNode body = mapper.createObjectNode();
        body.put("input_file_id", fileId);
        body.put("endpoint", "/v1/chat/completions");
        body.put("completion_window", "24h");

        HttpRequest req = authorized("/v1/batches")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();
        JsonNode root = mapper.readTree(send(req).body());
        String id = root.path("id").asText("");
        if (id.isEmpty()) throw new IOException("OpenAI batch response has no id: " + root);
        return id;
    }

    @Override
    public PollResult poll(String jobId, String defaultFocus) throws IOException, InterruptedException {
        JsonNode batch = mapper.readTree(send(authorized("/v1/batches/" + jobId).GET().build()).body());
        String status = batch.path("status").asText("");
        JsonNode counts = batch.path("request_counts");
        if (!TERMINAL.contains(status)) {
            int processing = Math.max(0, counts.path("total").asInt(0)
                    - counts.path("completed").asInt(0) - counts.path("failed").asInt(0));
            return PollResult.processing(jobId, processing);
        }

        String outputFileId = batch.path("output_file_id").asText("");
        if (outputFileId.isEmpty() || "null".equals(outputFileId)) {
            log.warn("OpenAI batch {} ended as {} without output", jobId, status);
            return PollResult.errored(jobId, Usage.NONE);
        }

        String jsonl = send(authorized("/v1/files/" + outputFileId + "/content").GET().build()).body();
        List<Finding> findings = new ArrayList<>();
        Usage usage = Usage.NONE;
        boolean succeeded = false;
        for (String line : jsonl.split("\n")) {
            if (line.isBlank()) continue;
            JsonNode response = mapper.readTree(line).path("response");
            if (response.path("status_code").asInt(0) != 200) {
                log.warn("OpenAI batch {} request failed: {}", jobId, response.path("body").path("error"));
                continue;
            }
            JsonNode body = response.path("body");
            JsonNode u = body.path("usage");
            usage = usage.plus(new Usage(
                    u.path("prompt_tokens").asLong(0),
                    u.path("completion_tokens").asLong(0),
                    u.path("prompt_tokens_details").path("cached_tokens").asLong(0),
                    0));
            String content = body.path("choices").path(0).path("message").path("content").asText("");
            findings.addAll(FindingParser.parse(content, defaultFocus));
            succeeded = true;
        }
        return succeeded ? PollResult.succeeded(jobId, findings, usage) : PollResult.errored(jobId, usage);
    }

    private String batchLine(AuditRequest request) throws IOException {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", request.maxOutputTokens());
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", request.systemPrompt());
        messages.addObject().put("role", "user")
                .put("content", AuditPrompts.userMessage(request.files(), request.decisionContext()));
        ObjectNode format = body.putObject("response_format");
        format.put("type", "json_schema");
        ObjectNode schema = format.putObject("json_schema");
        schema.put("name", "audit_findings");
        schema.set("schema", mapper.readTree(AuditPrompts.FINDING_SCHEMA));

        ObjectNode line = mapper.createObjectNode();
        line.put("custom_id", request.jobLabel());
        line.put("method", "POST");
        line.put("url", "/v1/chat/completions");
        line.set("body", body);
        return mapper.writeValueAsString(line) + "\n";
    }

    /** Multipart upload with purpose=batch; returns the file id. */
    private String upload(String jsonl) throws IOException, InterruptedException {
        String boundary = "----auditor" + UUID.randomUUID().toString().replace("-", "");
        String multipart = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"purpose\"\r\n\r\n"
                + "batch\r\n"
                + "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\"audit.jsonl\"\r\n"
                + "Content-Type: application/jsonl\r\n\r\n"
                + jsonl + "\r\n"
                + "--" + boundary + "--\r\n";

        HttpRequest req = authorized("/v1/files")
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofString(multipart, StandardCharsets.UTF_8))
                .build();
        JsonNode root = mapper.readTree(send(req).body());
        String id = root.path("id").asText("");
        if (id.isEmpty()) throw new IOException("OpenAI file upload returned no id: " + root);
        return id;
    }

    private HttpRequest.Builder authorized(String path) {
        return request(path).header("Authorization", "Bearer " + apiKey);
    }
}
