package dev.dimitra.auditor.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.junit5.WireMockRuntimeInfo;
import com.github.tomakehurst.wiremock.junit5.WireMockTest;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import dev.dimitra.auditor.model.FileContent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@WireMockTest
class ClaudeBatchProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String FINDINGS = "{\"findings\":[{\"severity\":\"high\",\"file\":\"app.py\",\"line\":3,"
            + "\"title\":\"Secret in code\",\"description\":\"API key committed\"}]}";

    private ClaudeBatchProvider provider;
    private String baseUrl;

    @BeforeEach
    void setUp(WireMockRuntimeInfo wm) {
        baseUrl = wm.getHttpBaseUrl();
        provider = new ClaudeBatchProvider("test-key", null, baseUrl, null);
        provider.setPollInterval(Duration.ZERO);
    }

    private static AuditRequest request(int focusCount) {
        return new AuditRequest(List.of(new FileContent("app.py", "KEY = 'abc'")), "Audit security.",
                "", "api-security+docs", focusCount);
    }

    private static String resultLine(String text) throws Exception {
        ObjectNode line = MAPPER.createObjectNode();
        line.put("custom_id", "api-security");
        ObjectNode result = line.putObject("result");
        result.put("type", "succeeded");
        ObjectNode message = result.putObject("message");
        message.putArray("content").addObject().put("type", "text").put("text", text);
        message.putObject("usage")
                .put("input_tokens", 1200).put("output_tokens", 300)
                .put("cache_read_input_tokens", 50).put("cache_creation_input_tokens", 10);
        return MAPPER.writeValueAsString(line);
    }

    private void stubEnded(String jsonl) {
        stubFor(get(urlEqualTo("/v1/messages/batches/msgbatch_1"))
                .willReturn(okJson("{\"id\":\"msgbatch_1\",\"processing_status\":\"ended\",\"results_url\":\""
                        + baseUrl + "/results/msgbatch_1\"}")));
        stubFor(get(urlEqualTo("/results/msgbatch_1")).willReturn(ok(jsonl)));
    }

    @Test
    @DisplayName("submit posts one batch request with the job label and scaled max_tokens")
    void submit() throws Exception {
        stubFor(post(urlEqualTo("/v1/messages/batches")).willReturn(okJson("{\"id\":\"msgbatch_1\"}")));

        String id = provider.submit(request(2));

        assertThat(id).isEqualTo("msgbatch_1");
        verify(postRequestedFor(urlEqualTo("/v1/messages/batches"))
                .withHeader("x-api-key", equalTo("test-key"))
                .withHeader("anthropic-version", equalTo("2023-06-01"))
                .withRequestBody(matchingJsonPath("$.requests[0].custom_id", equalTo("api-security_docs")))
                .withRequestBody(matchingJsonPath("$.requests[0].params.max_tokens", equalTo("8192")))
                .withRequestBody(matchingJsonPath("$.requests[0].params.model", equalTo(ClaudeBatchProvider.DEFAULT_MODEL)))
                .withRequestBody(matchingJsonPath("$.requests[0].params.system", equalTo("Audit security."))));
    }

    @Test
    void pollWhileProcessing() throws Exception {
        stubFor(get(urlEqualTo("/v1/messages/batches/msgbatch_1"))
                .willReturn(okJson("{\"processing_status\":\"in_progress\",\"request_counts\":{\"processing\":1}}")));

        AuditProvider.PollResult r = provider.poll("msgbatch_1", "security");

        assertThat(r.status()).isEqualTo(AuditProvider.BatchStatus.PROCESSING);
        assertThat(r.processing()).isEqualTo(1);
        assertThat(r.findings()).isEmpty();
    }

    @Test
    @DisplayName("ended batch yields parsed findings and usage including cache tokens")
    void pollEnded() throws Exception {
        stubEnded(resultLine(FINDINGS) + "\n");

        AuditProvider.PollResult r = provider.poll("msgbatch_1", "security");

        assertThat(r.status()).isEqualTo(AuditProvider.BatchStatus.SUCCEEDED);
        assertThat(r.findings()).singleElement().satisfies(f -> {
            assertThat(f.title()).isEqualTo("Secret in code");
            assertThat(f.focus()).isEqualTo("security");
        });
        assertThat(r.usage()).isEqualTo(new AuditProvider.Usage(1200, 300, 50, 10));
    }

    @Test
    void erroredRequestEndsAsErrored() throws Exception {
        stubEnded("{\"custom_id\":\"x\",\"result\":{\"type\":\"errored\",\"error\":{\"type\":\"overloaded\"}}}\n");

        AuditProvider.PollResult r = provider.poll("msgbatch_1", null);

        assertThat(r.status()).isEqualTo(AuditProvider.BatchStatus.ERRORED);
        assertThat(r.findings()).isEmpty();
    }

    @Test
    void malformedOutputIsRejected() throws Exception {
        stubEnded(resultLine("I could not find anything.") + "\n");

        assertThatThrownBy(() -> provider.poll("msgbatch_1", null)).isInstanceOf(MalformedResponseException.class);
    }

    @Test
    @DisplayName("runToCompletion keeps polling until the batch ends")
    void runToCompletion() throws Exception {
        stubFor(post(urlEqualTo("/v1/messages/batches")).willReturn(okJson("{\"id\":\"msgbatch_1\"}")));
        stubFor(get(urlEqualTo("/v1/messages/batches/msgbatch_1")).inScenario("batch")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(okJson("{\"processing_status\":\"in_progress\",\"request_counts\":{\"processing\":1}}"))
                .willSetStateTo("ended"));
        stubFor(get(urlEqualTo("/v1/messages/batches/msgbatch_1")).inScenario("batch")
                .whenScenarioStateIs("ended")
                .willReturn(okJson("{\"processing_status\":\"ended\",\"results_url\":\"" + baseUrl + "/results/msgbatch_1\"}")));
        stubFor(get(urlEqualTo("/results/msgbatch_1")).willReturn(ok(resultLine(FINDINGS))));

        AuditProvider.PollResult r = provider.runToCompletion(request(1), "security");

        assertThat(r.findings()).hasSize(1);
        verify(2, getRequestedFor(urlEqualTo("/v1/messages/batches/msgbatch_1")));
    }

    @Test
    void httpErrorCarriesStatusAndBody() {
        stubFor(post(urlEqualTo("/v1/messages/batches")).willReturn(aResponse().withStatus(401).withBody("bad key")));

        assertThatThrownBy(() -> provider.submit(request(1)))
                .isInstanceOf(IOException.class)
                .hasMessage("Claude API error 401: bad key");
    }

    @Test
    void customIdIsSanitized() {
        assertThat(ClaudeBatchProvider.customId("my repo/security+docs")).isEqualTo("my_repo_security_docs");
        assertThat(ClaudeBatchProvider.customId("x".repeat(80))).hasSize(64);
        assertThat(ClaudeBatchProvider.customId(null)).isEqualTo("audit");
    }
}
