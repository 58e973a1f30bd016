package io.forthic.bridge;

import io.forthic.error.ErrorInfo;
import io.forthic.error.ModuleImportException;
import io.forthic.model.RuntimeValue;
import io.forthic.model.RuntimeValues;
import io.forthic.module.Module;
import io.forthic.module.ModuleRegistry;
import io.forthic.module.WordDoc;
import io.forthic.observability.ExecutionLog;
import io.forthic.runtime.Interpreter;
import io.forthic.runtime.StandardInterpreter;
import io.forthic.wire.ExecuteSequenceRequest;
import io.forthic.wire.ExecuteWordRequest;
import io.forthic.wire.ExecutionResponse;
import io.forthic.wire.ModuleInfo;
import io.forthic.wire.ModuleSummary;
import io.forthic.wire.WordInfo;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes words on behalf of remote runtimes. Every request gets a fresh interpreter
 * over the shared, frozen module registry, so requests never see each other's stacks
 * or variables.
 */
public final class ForthicRuntimeService implements AutoCloseable {
    public static final String TIMEOUT_ERROR = "TimeoutError";
    public static final String SERIALIZATION_ERROR = "SerializationError";
    public static final String RECURSION_ERROR = "RecursionError";

    private final ModuleRegistry registry;
    private final List<String> importedModules;
    private final ZoneId timezone;
    private final long requestTimeoutMs;
    private final ExecutionLog executionLog;
    private final ExecutorService executor;

    public ForthicRuntimeService(ModuleRegistry registry, List<String> importedModules, ZoneId timezone) {
        this(registry, importedModules, timezone, 0L, null);
    }

    /**
     * @param importedModules modules imported, unprefixed and in order, into each request's interpreter
     * @param requestTimeoutMs whole-call limit; zero or less disables it
     * @param executionLog optional per-request log
     */
    public ForthicRuntimeService(
            ModuleRegistry registry,
            List<String> importedModules,
            ZoneId timezone,
            long requestTimeoutMs,
            ExecutionLog executionLog
    ) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        this.registry = registry;
        this.importedModules = importedModules == null ? List.of() : List.copyOf(importedModules);
        this.timezone = timezone;
        this.requestTimeoutMs = requestTimeoutMs;
        this.executionLog = executionLog;
        this.executor = requestTimeoutMs > 0 ? Executors.newCachedThreadPool(daemonThreads()) : null;
    }

    public ExecutionResponse executeWord(ExecuteWordRequest request) {
        long started = System.nanoTime();
        Map<String, String> context = Map.of("word_name", request.wordName());
        ExecutionResponse response = execute(() -> {
            Interpreter interp = newInterpreter();
            request.stack().forEach(interp::push);
            interp.dispatch(interp.findWord(request.wordName()));
            return interp.stackItems();
        }, context);
        record("execute_word", List.of(request.wordName()), request.stack().size(), response, started);
        return response;
    }

    /**
     * Runs the words in order against one evolving stack and stops at the first failure.
     * The error context names the whole sequence and the failing word.
     */
    public ExecutionResponse executeSequence(ExecuteSequenceRequest request) {
        long started = System.nanoTime();
        Map<String, String> context = new LinkedHashMap<>();
        context.put("word_sequence", String.join(", ", request.wordNames()));
        ExecutionResponse response = execute(() -> {
            Interpreter interp = newInterpreter();
            request.stack().forEach(interp::push);
            for (int i = 0; i < request.wordNames().size(); i++) {
                String wordName = request.wordNames().get(i);
                synchronized (context) {
                    context.put("word_name", wordName);
                    context.put("word_index", Integer.toString(i));
                }
                interp.dispatch(interp.findWord(wordName));
            }
            synchronized (context) {
                context.remove("word_name");
                context.remove("word_index");
            }
            return interp.stackItems();
        }, context);
        record("execute_sequence", request.wordNames(), request.stack().size(), response, started);
        return response;
    }

    public List<ModuleSummary> listModules() {
        List<ModuleSummary> summaries = new ArrayList<>();
        for (Map.Entry<String, Module> entry : registry.asMap().entrySet()) {
            Module module = entry.getValue();
            summaries.add(new ModuleSummary(
                    entry.getKey(),
                    module.description(),
                    module.words().size(),
                    module.isRuntimeSpecific()));
        }
        return summaries;
    }

    public ModuleInfo getModuleInfo(String moduleName) {
        Module module = registry.find(moduleName).orElseThrow(() -> new ModuleImportException(moduleName));
        List<WordInfo> words = new ArrayList<>();
        for (WordDoc doc : module.wordDocs()) {
            words.add(new WordInfo(doc.name(), doc.stackEffect(), doc.description()));
        }
        return new ModuleInfo(moduleName, module.description(), words);
    }

    private Interpreter newInterpreter() {
        Interpreter interp = new StandardInterpreter(registry, timezone);
        for (String moduleName : importedModules) {
            interp.useModule(moduleName, "");
        }
        return interp;
    }

    private ExecutionResponse execute(Callable<List<RuntimeValue>> work, Map<String, String> context) {
        try {
            List<RuntimeValue> result = executor == null
                    ? work.call()
                    : awaitWithTimeout(work);
            return serializable(result);
        } catch (TimeoutException e) {
            return ExecutionResponse.fail(ErrorInfo.of(TIMEOUT_ERROR,
                    "Request exceeded " + requestTimeoutMs + " ms and was abandoned"));
        } catch (ExecutionException e) {
            if (e.getCause() instanceof StackOverflowError) {
                return stackExhausted(context);
            }
            return ExecutionResponse.fail(ErrorInfo.fromException(e.getCause(), snapshot(context)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResponse.fail(ErrorInfo.fromException(e, snapshot(context)));
        } catch (StackOverflowError e) {
            return stackExhausted(context);
        } catch (Exception e) {
            return ExecutionResponse.fail(ErrorInfo.fromException(e, snapshot(context)));
        }
    }

    // Native words can recurse outside any definition, e.g. on deeply nested values.
    private static ExecutionResponse stackExhausted(Map<String, String> context) {
        return ExecutionResponse.fail(new ErrorInfo("Call stack exhausted while executing the request",
                ErrorInfo.RUNTIME, List.of(), RECURSION_ERROR, "", "", snapshot(context)));
    }

    private List<RuntimeValue> awaitWithTimeout(Callable<List<RuntimeValue>> work)
            throws InterruptedException, ExecutionException, TimeoutException {
        Future<List<RuntimeValue>> future = executor.submit(work);
        try {
            return future.get(requestTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static ExecutionResponse serializable(List<RuntimeValue> result) {
        for (int i = 0; i < result.size(); i++) {
            if (!RuntimeValues.isSerializable(result.get(i))) {
                return ExecutionResponse.fail(ErrorInfo.of(SERIALIZATION_ERROR,
                        "Result stack item " + i + " is a " + result.get(i).kind().label()
                                + " value, which cannot leave this runtime"));
            }
        }
        return ExecutionResponse.ok(result);
    }

    private static Map<String, String> snapshot(Map<String, String> context) {
        synchronized (context) {
            return new LinkedHashMap<>(context);
        }
    }

    private void record(String operation, List<String> words, int stackDepth, ExecutionResponse response, long startedNanos) {
        if (executionLog == null) {
            return;
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
        ExecutionLog.ExecutionEvent event = response.isError()
                ? ExecutionLog.ExecutionEvent.failed(operation, words, stackDepth, response.error().errorType(), durationMs)
                : ExecutionLog.ExecutionEvent.ok(operation, words, stackDepth, durationMs);
        try {
            executionLog.log(event);
        } catch (RuntimeException e) {
            System.err.println("WARN execution log write failed: " + e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "forthic-request");
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
