package dev.dimitra.auditor.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpRequest;

/**
 * Google Gemini via the synchronous generateContent endpoint.
 *
 * See: https://generativelanguage.googleapis.com/v1beta/models/{model}:generateContent
 */
public class GeminiProvider extends SynchronousAuditProvider {

    public static final String NAME = "gemini";
    public static final String DEFAULT_MODEL = "gemini-2.5-flash";

    public GeminiProvider(String apiKey, String model, String baseUrl) {
        super("GOOGLE_API_KEY", apiKey, model, DEFAULT_MODEL, baseUrl, "https://generativelanguage.googleapis.com");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String vendor() {
        return "Gemini";
    }

    @Override
    protected Completion complete(AuditRequest request) throws IOException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();

        // System prompt -> system_instruction
        body.putObject("system_instruction").putArray("parts").addObject()
                .put("text", request.systemPrompt());

        ObjectNode content = body.putArray("contents").addObject();
        content.put("role", "user");
        content.putArray("parts").addObject()
                .put("text", AuditPrompts.userMessage(request.files(), request.decisionContext()));

        ObjectNode config = body.putObject("generationConfig");
        config.put("temperature", 0.2);
        config.put("maxOutputTokens", request.maxOutputTokens());
        config.put("responseMimeType", "application/json");

        HttpRequest req = request("/v1beta/models/" + model + ":generateContent?key=" + apiKey)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                .build();

        JsonNode root = mapper.readTree(send(req).body());

        // candidates[0].content.parts[*].text
        StringBuilder text = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }

        JsonNode usage = root.path("usageMetadata");
        return new Completion(text.toString(), new Usage(
                usage.path("promptTokenCount").asLong(0),
                usage.path("candidatesTokenCount").asLong(0),
                usage.path("cachedContentTokenCount").asLong(0),
                0));
    }
}
