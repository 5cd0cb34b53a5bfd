package exray.bridge.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import exray.bridge.config.BridgeConfig;
import exray.bridge.error.EngineQueryException;
import exray.bridge.error.EngineSubmissionException;
import exray.bridge.model.SubmissionReceipt;
import exray.bridge.template.FilledSpec;
import exray.bridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.IOException;
import java.net.Socket;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Argo Workflows server REST client.
 *
 * POST {base}/api/v1/workflows/{ns}            - submit
 * GET  {base}/api/v1/workflows/{ns}/{name}     - fetch
 * GET  {base}/api/v1/workflows/{ns}/{name}/log - logs
 */
public class ArgoWorkflowClient implements WorkflowEngineClient {

    private static final Logger log = LoggerFactory.getLogger(ArgoWorkflowClient.class);

    private final String workflowsUrl;
    private final String namespace;
    private final String bearerToken;
    private final Duration timeout;
    private final Duration submitTimeout;
    private final HttpClient httpClient;

    public ArgoWorkflowClient(BridgeConfig config) {
        this(config.engineUrl(), config.engineNamespace(), config.engineToken(), config.engineTimeout(),
                config.engineSubmitTimeout(), config.engineInsecureTls());
    }

    public ArgoWorkflowClient(String baseUrl, String namespace, String bearerToken, Duration timeout,
            Duration submitTimeout, boolean insecureTls) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.namespace = namespace;
        this.workflowsUrl = base + "/api/v1/workflows/" + encode(namespace);
        this.bearerToken = bearerToken;
        this.timeout = timeout;
        this.submitTimeout = submitTimeout;

        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        if (insecureTls) {
            builder.sslContext(trustAllContext());
        }
        this.httpClient = builder.build();
    }

    @Override
    public SubmissionReceipt submit(FilledSpec spec) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.set("workflow", spec.workflow());

        HttpRequest request = request(URI.create(workflowsUrl), submitTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toJson(body), StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new EngineSubmissionException("Workflow submission of " + spec.templateName()
                    + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineSubmissionException("Workflow submission of " + spec.templateName()
                    + " interrupted", e);
        }

        if (!isSuccess(response.statusCode())) {
            throw new EngineSubmissionException(response.statusCode(), response.body());
        }

        JsonNode metadata;
        try {
            metadata = Jsons.mapper().readTree(response.body()).path("metadata");
        } catch (IOException e) {
            throw new EngineSubmissionException("Workflow submission of " + spec.templateName()
                    + " returned an unreadable body", e);
        }

        String engineName = Jsons.text(metadata, "name");
        String ns = Jsons.text(metadata, "namespace");
        SubmissionReceipt receipt = new SubmissionReceipt(
                engineName,
                ns != null ? ns : namespace,
                Jsons.text(metadata, "creationTimestamp"));
        log.info("Submitted workflow {} from template {}", engineName, spec.templateName());
        return receipt;
    }

    @Override
    public Optional<WorkflowDocument> fetch(String engineName) {
        HttpRequest request = request(URI.create(workflowsUrl + "/" + encode(engineName)), timeout)
                .GET()
                .build();

        HttpResponse<String> response = send(request, "fetch workflow", engineName);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        if (!isSuccess(response.statusCode())) {
            throw new EngineQueryException("fetch workflow", engineName, response.statusCode(), response.body());
        }
        try {
            return Optional.of(WorkflowDocument.of(Jsons.mapper().readTree(response.body())));
        } catch (IOException e) {
            throw new EngineQueryException("fetch workflow", engineName, e);
        }
    }

    @Override
    public String fetchLogs(String engineName, String podName, String container, Integer tailLines) {
        Map<String, String> query = new LinkedHashMap<>();
        if (tailLines != null && tailLines > 0) {
            query.put("logOptions.tailLines", String.valueOf(tailLines));
        }
        if (podName != null) {
            query.put("podName", podName);
        }
        query.put("logOptions.container", container != null ? container : MAIN_CONTAINER);

        StringJoiner qs = new StringJoiner("&", "?", "");
        query.forEach((k, v) -> qs.add(encode(k) + "=" + encode(v)));

        String target = podName != null ? engineName + "/" + podName : engineName;
        HttpRequest request = request(URI.create(workflowsUrl + "/" + encode(engineName) + "/log" + qs), timeout)
                .GET()
                .build();

        HttpResponse<String> response = send(request, "fetch logs", target);
        if (!isSuccess(response.statusCode())) {
            throw new EngineQueryException("fetch logs", target, response.statusCode(), response.body());
        }
        return unwrapLogStream(response.body());
    }

    @Override
    public boolean ping() {
        HttpRequest request = request(URI.create(workflowsUrl), timeout).GET().build();
        try {
            int status = httpClient.send(request, HttpResponse.BodyHandlers.discarding()).statusCode();
            return status == 200 || status == 401 || status == 403;
        } catch (IOException e) {
            log.debug("Engine ping failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * The log endpoint streams one {"result":{"content":...}} object per line.
     * Lines that are not such envelopes are kept verbatim.
     */
    static String unwrapLogStream(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        for (String line : body.split("\r?\n")) {
            if (line.isBlank()) {
                continue;
            }
            String content = line;
            if (line.startsWith("{")) {
                try {
                    JsonNode result = Jsons.mapper().readTree(line).path("result");
                    if (result.has("content")) {
                        content = result.path("content").asText("");
                    }
                } catch (IOException e) {
                    content = line;
                }
            }
            out.append(content).append('\n');
        }
        return out.toString();
    }

    private HttpResponse<String> send(HttpRequest request, String operation, String target) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new EngineQueryException(operation, target, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineQueryException(operation, target, e);
        }
    }

    private HttpRequest.Builder request(URI uri, Duration requestTimeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (bearerToken != null && !bearerToken.isBlank()) {
            builder.header("Authorization", "Bearer " + bearerToken);
        }
        return builder;
    }

    private static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static SSLContext trustAllContext() {
        try {
            SSLContext ssl = SSLContext.getInstance("TLS");
            ssl.init(null, new TrustManager[] { new TrustAllManager() }, null);
            return ssl;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to build TLS context for the workflow engine", e);
        }
    }

    /** The engine server ships with a self-signed certificate. */
    private static final class TrustAllManager extends X509ExtendedTrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
