package io.forthic.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import io.forthic.error.ErrorInfo;
import io.forthic.error.RemoteExecutionException;
import io.forthic.model.RuntimeValue;
import io.forthic.util.Jsons;
import io.forthic.wire.ExecuteSequenceRequest;
import io.forthic.wire.ExecuteWordRequest;
import io.forthic.wire.ExecutionResponse;
import io.forthic.wire.ModuleInfo;
import io.forthic.wire.ModuleSummary;
import io.forthic.wire.WireCodec;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

public final class RuntimeClient {
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final String address;
    private final String baseUrl;
    private final HttpClient http;

    /**
     * @param address {@code host:port} or a full {@code http://} URL
     */
    public RuntimeClient(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("runtime address must not be empty");
        }
        this.address = address.trim();
        String base = this.address.startsWith("http://") || this.address.startsWith("https://")
                ? this.address
                : "http://" + this.address;
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.baseUrl = base + RuntimeServer.BASE_PATH;
        this.http = HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
    }

    public String address() {
        return address;
    }

    public List<RuntimeValue> executeWord(String wordName, List<RuntimeValue> stack) {
        JsonNode body = post("/execute-word", WireCodec.encodeExecuteWordRequest(new ExecuteWordRequest(wordName, stack)));
        return unwrap(WireCodec.decodeResponse(body));
    }

    public List<RuntimeValue> executeSequence(List<String> wordNames, List<RuntimeValue> stack) {
        JsonNode body = post("/execute-sequence",
                WireCodec.encodeExecuteSequenceRequest(new ExecuteSequenceRequest(wordNames, stack)));
        return unwrap(WireCodec.decodeResponse(body));
    }

    public List<ModuleSummary> listModules() {
        return WireCodec.decodeModules(get("/modules"));
    }

    public ModuleInfo getModuleInfo(String moduleName) {
        return WireCodec.decodeModuleInfo(get("/modules/" + URLEncoder.encode(moduleName, StandardCharsets.UTF_8)));
    }

    public boolean isHealthy() {
        try {
            return "ok".equals(get("/health").path("status").asText(""));
        } catch (RemoteExecutionException e) {
            return false;
        }
    }

    private static List<RuntimeValue> unwrap(ExecutionResponse response) {
        if (response.isError()) {
            throw RemoteExecutionException.fromErrorInfo(response.error());
        }
        return response.resultStack();
    }

    private JsonNode get(String path) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();
        return send(request, path);
    }

    private JsonNode post(String path, JsonNode payload) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(payload), StandardCharsets.UTF_8))
                .build();
        return send(request, path);
    }

    private JsonNode send(HttpRequest request, String path) {
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw transportFailure("request to " + address + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw transportFailure("request to " + address + path + " was interrupted", e);
        }
        JsonNode body;
        try {
            body = Jsons.readTree(response.body());
        } catch (IllegalArgumentException e) {
            throw transportFailure("runtime " + address + " returned status=" + response.statusCode()
                    + " with a non-JSON body", e);
        }
        if (response.statusCode() == 404 && "module_not_found".equals(body.path("error").asText(""))) {
            String moduleName = body.path("module").asText("");
            ErrorInfo info = ErrorInfo.of("ModuleNotFoundError", "Module '" + moduleName + "' not found");
            throw new RemoteExecutionException("Module '" + moduleName + "' not found on runtime " + address, info);
        }
        if (response.statusCode() / 100 != 2) {
            throw transportFailure("runtime " + address + " returned status=" + response.statusCode()
                    + " error=" + body.path("error").asText("unknown"), null);
        }
        return body;
    }

    private RemoteExecutionException transportFailure(String message, Throwable cause) {
        return new RemoteExecutionException(message, ErrorInfo.of("TransportError", message), cause);
    }
}
