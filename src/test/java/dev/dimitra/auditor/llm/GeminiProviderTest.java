package dev.dimitra.auditor.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import dev.dimitra.auditor.model.FileContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

@WireMockTest
class GeminiProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private GeminiProvider provider;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wm) throws Exception {
        provider = new GeminiProvider("g-key", null, wm.getHttpBaseUrl());

        ObjectNode body = MAPPER.createObjectNode();
        body.putArray("candidates").addObject().putObject("content").putArray("parts").addObject()
                .put("text", "{\"findings\":[{\"severity\":\"low\",\"file\":\"README.md\",\"title\":\"Stale docs\",\"description\":\"outdated\"}]}");
        body.putObject("usageMetadata").put("promptTokenCount", 500).put("candidatesTokenCount", 40)
                .put("cachedContentTokenCount", 100);
        stubFor(post(urlPathEqualTo("/v1beta/models/gemini-2.5-flash:generateContent"))
                .withQueryParam("key", equalTo("g-key"))
                .willReturn(okJson(MAPPER.writeValueAsString(body))));
    }

    private static AuditRequest request() {
        return new AuditRequest(List.of(new FileContent("README.md", "# old")), "Audit docs.", "", "api-docs", 1);
    }

    @Test
    @DisplayName("submit calls the endpoint once and poll returns the stored answer as ended")
    void submitThenPoll() throws Exception {
        String jobId = provider.submit(request());

        AuditProvider.PollResult r = provider.poll(jobId, "docs");

        assertThat(jobId).startsWith("gemini-");
        assertThat(r.status()).isEqualTo(AuditProvider.BatchStatus.SUCCEEDED);
        assertThat(r.findings()).singleElement().satisfies(f -> assertThat(f.focus()).isEqualTo("docs"));
        assertThat(r.usage()).isEqualTo(new AuditProvider.Usage(500, 40, 100, 0));
        verify(1, postRequestedFor(urlPathEqualTo("/v1beta/models/gemini-2.5-flash:generateContent"))
                .withRequestBody(matchingJsonPath("$.system_instruction.parts[0].text", equalTo("Audit docs.")))
                .withRequestBody(matchingJsonPath("$.generationConfig.responseMimeType", equalTo("application/json"))));
    }

    @Test
    void runToCompletionDoesNotWait() throws Exception {
        AuditProvider.PollResult r = provider.runToCompletion(request(), "docs");

        assertThat(r.isEnded()).isTrue();
        assertThat(r.findings()).hasSize(1);
    }

    @Test
    @DisplayName("a job id from another process polls as errored")
    void unknownJobIsErrored() throws Exception {
        AuditProvider.PollResult r = provider.poll("gemini-lost", "docs");

        assertThat(r.status()).isEqualTo(AuditProvider.BatchStatus.ERRORED);
        assertThat(r.findings()).isEmpty();
    }

    @Test
    @DisplayName("with a results directory another instance can poll the stored answer")
    void persistedAnswerOutlivesInstance(WireMockRuntimeInfo wm, @TempDir Path results) throws Exception {
        provider.persistTo(results);
        String jobId = provider.submit(request());

        GeminiProvider restarted = new GeminiProvider("g-key", null, wm.getHttpBaseUrl());
        restarted.persistTo(results);
        AuditProvider.PollResult r = restarted.poll(jobId, "docs");

        assertThat(results.resolve(jobId + ".json")).exists();
        assertThat(r.status()).isEqualTo(AuditProvider.BatchStatus.SUCCEEDED);
        assertThat(r.findings()).hasSize(1);
        assertThat(r.usage()).isEqualTo(new AuditProvider.Usage(500, 40, 100, 0));
        verify(1, postRequestedFor(urlPathEqualTo("/v1beta/models/gemini-2.5-flash:generateContent")));
    }
}
