package dev.dimitra.auditor.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Shared HTTP plumbing and the blocking poll loop.
 */
public abstract class AbstractAuditProvider implements AuditProvider {

    private static final Logger log = LoggerFactory.getLogger(AbstractAuditProvider.class);

    protected static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);
    protected static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(120);

    protected final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(CONNECT_TIMEOUT)
            .build();
    protected final ObjectMapper mapper = new ObjectMapper();
    protected final String apiKey;
    protected final String model;
    protected final String baseUrl;
    private Duration pollInterval = Duration.ofSeconds(60);

    protected AbstractAuditProvider(String apiKeyEnv, String apiKey, String model, String defaultModel,
                                    String baseUrl, String defaultBaseUrl) {
        this.apiKey = Objects.requireNonNull(apiKey, apiKeyEnv + " missing");
        this.model = (model == null || model.isBlank()) ? defaultModel : model;
        String url = (baseUrl == null || baseUrl.isBlank()) ? defaultBaseUrl : baseUrl;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public Duration pollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = Objects.requireNonNull(pollInterval);
    }

    @Override
    public PollResult runToCompletion(AuditRequest request, String defaultFocus)
            throws IOException, InterruptedException {
        String jobId = submit(request);
        log.info("{} job submitted: {}", name(), jobId);
        while (true) {
            PollResult result = poll(jobId, defaultFocus);
            if (result.isEnded()) {
                return result;
            }
            log.info("Waiting on {} job {} ({} processing)", name(), jobId, result.processing());
            Thread.sleep(pollInterval.toMillis());
        }
    }

    protected HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(path.startsWith("http") ? path : baseUrl + path))
                .timeout(REQUEST_TIMEOUT);
    }

    protected HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException {
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() / 100 != 2) {
            throw new IOException(vendor() + " API error " + resp.statusCode() + ": " + resp.body());
        }
        return resp;
    }

    /** Vendor name used in error messages. */
    protected abstract String vendor();
}
