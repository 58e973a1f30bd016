package io.forthic.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.forthic.error.ModuleImportException;
import io.forthic.util.Jsons;
import io.forthic.wire.ExecuteSequenceRequest;
import io.forthic.wire.ExecuteWordRequest;
import io.forthic.wire.WireCodec;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public final class RuntimeServer implements AutoCloseable {
    public static final String BASE_PATH = "/forthic";

    private final ForthicRuntimeService service;
    private final HttpServer server;
    private final ExecutorService workers;

    public RuntimeServer(ForthicRuntimeService service, String bindHost, int port, int workerThreads) throws IOException {
        this.service = service;
        this.server = HttpServer.create(new InetSocketAddress(bindHost, port), 0);
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads));
        server.createContext(BASE_PATH + "/execute-word", guarded(exchange -> {
            if (!requireMethod(exchange, "POST")) return;
            JsonNode body = readBody(exchange);
            if (body == null) return;
            ExecuteWordRequest request;
            try {
                request = WireCodec.decodeExecuteWordRequest(body);
            } catch (IllegalArgumentException e) {
                writeJson(exchange, Map.of("error", "invalid_request", "message", String.valueOf(e.getMessage())), 400);
                return;
            }
            writeJson(exchange, WireCodec.encodeResponse(service.executeWord(request)), 200);
        }));
        server.createContext(BASE_PATH + "/execute-sequence", guarded(exchange -> {
            if (!requireMethod(exchange, "POST")) return;
            JsonNode body = readBody(exchange);
            if (body == null) return;
            ExecuteSequenceRequest request;
            try {
                request = WireCodec.decodeExecuteSequenceRequest(body);
            } catch (IllegalArgumentException e) {
                writeJson(exchange, Map.of("error", "invalid_request", "message", String.valueOf(e.getMessage())), 400);
                return;
            }
            writeJson(exchange, WireCodec.encodeResponse(service.executeSequence(request)), 200);
        }));
        server.createContext(BASE_PATH + "/modules", guarded(exchange -> {
            if (!requireMethod(exchange, "GET")) return;
            String path = exchange.getRequestURI().getRawPath();
            String prefix = BASE_PATH + "/modules";
            String rest = path.length() > prefix.length() ? path.substring(prefix.length()) : "";
            if (rest.isEmpty() || "/".equals(rest)) {
                writeJson(exchange, WireCodec.encodeModules(service.listModules()), 200);
                return;
            }
            String moduleName = URLDecoder.decode(rest.substring(1), StandardCharsets.UTF_8);
            try {
                writeJson(exchange, WireCodec.encodeModuleInfo(service.getModuleInfo(moduleName)), 200);
            } catch (ModuleImportException e) {
                writeJson(exchange, Map.of("error", "module_not_found", "module", moduleName), 404);
            }
        }));
        server.createContext(BASE_PATH + "/health", guarded(exchange -> {
            if (!requireMethod(exchange, "GET")) return;
            writeJson(exchange, Map.of("status", "ok", "runtime", "java"), 200);
        }));
        server.setExecutor(workers);
    }

    public void start() {
        server.start();
    }

    public int port() {
        return server.getAddress().getPort();
    }

    public String address() {
        return server.getAddress().getHostString() + ":" + port();
    }

    @Override
    public void close() {
        server.stop(0);
        workers.shutdownNow();
        service.close();
    }

    private static HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (RuntimeException | StackOverflowError e) {
                System.err.println("ERROR request " + exchange.getRequestURI().getPath() + " failed: " + e);
                writeJson(exchange, Map.of("error", "internal_error", "message", String.valueOf(e.getMessage())), 500);
            } finally {
                exchange.close();
            }
        };
    }

    private static boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
        return false;
    }

    private static JsonNode readBody(HttpExchange exchange) throws IOException {
        String raw = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        try {
            JsonNode node = Jsons.readTree(raw);
            if (!node.isObject()) {
                writeJson(exchange, Map.of("error", "invalid_json", "message", "request body must be a JSON object"), 400);
                return null;
            }
            return node;
        } catch (IllegalArgumentException e) {
            writeJson(exchange, Map.of("error", "invalid_json", "message", String.valueOf(e.getMessage())), 400);
            return null;
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
