package dev.dimitra.auditor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * DeepSeek's OpenAI-compatible chat completions endpoint. No batch API, so calls are
 * synchronous.
 */
public class DeepSeekProvider extends SynchronousAuditProvider {

    public static final String NAME = "deepseek";
    public static final String DEFAULT_MODEL = "deepseek-chat";

    private static final int MAX_OUTPUT_TOKENS = 8192;

    public DeepSeekProvider(String apiKey, String model, String baseUrl) {
        super("DEEPSEEK_API_KEY", apiKey, model, DEFAULT_MODEL, baseUrl, "https://api.deepseek.com");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String vendor() {
        return "DeepSeek";
    }

    @Override
    protected Completion complete(AuditRequest request) throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        ArrayNode msgs = body.putArray("messages");
        msgs.addObject().put("role", "system").put("content", request.systemPrompt());
        msgs.addObject().put("role", "user")
                .put("content", AuditPrompts.userMessage(request.files(), request.decisionContext()));
        body.put("max_tokens", Math.min(MAX_OUTPUT_TOKENS, request.maxOutputTokens()));
        body.put("temperature", 0.2);
        body.putObject("response_format").put("type", "json_object");

        HttpRequest req = request("/chat/completions")
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();

        JsonNode root = mapper.readTree(send(req).body());
        String text = root.path("choices").path(0).path("message").path("content").asText("");
        // usage may not always be present
        JsonNode usage = root.path("usage");
        return new Completion(text, new Usage(
                usage.path("prompt_tokens").asLong(0),
                usage.path("completion_tokens").asLong(0),
                usage.path("prompt_cache_hit_tokens").asLong(0),
                0));
    }
}
