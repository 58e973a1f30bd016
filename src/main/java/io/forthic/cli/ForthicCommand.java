package io.forthic.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.forthic.bridge.ForthicRuntimeService;
import io.forthic.bridge.RuntimeClient;
import io.forthic.bridge.RuntimeServer;
import io.forthic.config.ForthicConfig;
import io.forthic.config.ModuleLoader;
import io.forthic.error.ForthicException;
import io.forthic.error.IntentionalStopException;
import io.forthic.error.RemoteExecutionException;
import io.forthic.model.RuntimeValue;
import io.forthic.model.RuntimeValues;
import io.forthic.module.ModuleRegistry;
import io.forthic.observability.ExecutionLog;
import io.forthic.runtime.CoreModule;
import io.forthic.runtime.Interpreter;
import io.forthic.runtime.StandardInterpreter;
import io.forthic.token.CodeLocation;
import io.forthic.util.Jsons;
import io.forthic.wire.WireCodec;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "forthic",
        mixinStandardHelpOptions = true,
        description = "Forthic runtime CLI",
        subcommands = {
                ForthicCommand.RunCommand.class,
                ForthicCommand.ModulesCommand.class,
                ForthicCommand.ModuleInfoCommand.class,
                ForthicCommand.ServeCommand.class,
                ForthicCommand.RemoteCallCommand.class,
                ForthicCommand.RemoteModulesCommand.class
        }
)
public final class ForthicCommand implements Runnable {
    @Option(names = {"--modules-config"}, defaultValue = "${env:" + ForthicConfig.MODULES_CONFIG_ENV + "}",
            description = "Module list JSON file (env FORTHIC_MODULES_CONFIG)")
    String modulesConfig;

    @Option(names = {"--timezone"}, defaultValue = ForthicConfig.DEFAULT_TIMEZONE,
            description = "Zone used for date and datetime literals")
    String timezone;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | modules | module-info | serve | remote-call | remote-modules");
    }

    ForthicConfig config() {
        return ForthicConfig.fromOptions(modulesConfig, timezone);
    }

    ModuleRegistry registry() {
        return new ModuleLoader().load(config());
    }

    static List<String> importedModules(ModuleRegistry registry) {
        List<String> names = new ArrayList<>(registry.names());
        names.remove(CoreModule.NAME);
        return names;
    }

    static ArrayNode stackJson(List<RuntimeValue> stack) {
        ArrayNode out = Jsons.mapper().createArrayNode();
        for (RuntimeValue value : stack) {
            if (RuntimeValues.isSerializable(value)) {
                out.add(WireCodec.encodeValue(value));
            } else {
                out.add(RuntimeValues.describe(value));
            }
        }
        return out;
    }

    static int fail(ForthicException e) {
        System.err.println("ERROR " + e.errorType() + ": " + e.getMessage());
        return 1;
    }

    @Command(name = "run", description = "Run Forthic code and print the final stack")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        ForthicCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Forthic code")
        String code;

        @Option(names = {"--file"}, description = "Read Forthic code from a file")
        Path file;

        @Override
        public Integer call() throws Exception {
            if ((code == null) == (file == null)) {
                System.err.println("ERROR give either code or --file");
                return 2;
            }
            String source = file == null ? code : Files.readString(file, StandardCharsets.UTF_8);
            String reference = file == null ? "<command-line>" : file.toString();
            try {
                ModuleRegistry registry = parent.registry();
                Interpreter interp = new StandardInterpreter(registry, parent.config().timezone());
                for (String moduleName : importedModules(registry)) {
                    interp.useModule(moduleName, "");
                }
                try {
                    interp.run(source, CodeLocation.of(reference));
                } catch (IntentionalStopException e) {
                    return 0;
                }
                System.out.println(Jsons.toJson(stackJson(interp.stackItems())));
                return 0;
            } catch (ForthicException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "modules", description = "List loaded modules")
    static final class ModulesCommand implements Callable<Integer> {
        @ParentCommand
        ForthicCommand parent;

        @Override
        public Integer call() {
            try (ForthicRuntimeService service = new ForthicRuntimeService(
                    parent.registry(), List.of(), parent.config().timezone())) {
                System.out.println(Jsons.toJson(WireCodec.encodeModules(service.listModules())));
                return 0;
            } catch (ForthicException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "module-info", description = "Show the words of one module")
    static final class ModuleInfoCommand implements Callable<Integer> {
        @ParentCommand
        ForthicCommand parent;

        @Parameters(index = "0", description = "Module name")
        String moduleName;

        @Override
        public Integer call() {
            try (ForthicRuntimeService service = new ForthicRuntimeService(
                    parent.registry(), List.of(), parent.config().timezone())) {
                System.out.println(Jsons.toJson(WireCodec.encodeModuleInfo(service.getModuleInfo(moduleName))));
                return 0;
            } catch (ForthicException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "serve", description = "Serve the execution bridge over HTTP")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        ForthicCommand parent;

        @Option(names = {"--bind"}, defaultValue = ForthicConfig.DEFAULT_BIND, description = "Bind address")
        String bind;

        @Option(names = {"--port"}, defaultValue = "" + ForthicConfig.DEFAULT_PORT, description = "Listen port")
        int port;

        @Option(names = {"--workers"}, defaultValue = "" + ForthicConfig.DEFAULT_WORKER_THREADS,
                description = "HTTP worker threads")
        int workers;

        @Option(names = {"--request-timeout-ms"}, defaultValue = "" + ForthicConfig.DEFAULT_REQUEST_TIMEOUT_MS,
                description = "Per-request limit in ms, 0 disables it")
        long requestTimeoutMs;

        @Option(names = {"--exec-log"}, description = "Append one JSON line per request to this file")
        String execLog;

        @Override
        public Integer call() throws Exception {
            ModuleRegistry registry;
            try {
                registry = parent.registry();
            } catch (ForthicException e) {
                return fail(e);
            }
            ExecutionLog log = execLog == null || execLog.isBlank() ? null : new ExecutionLog(Paths.get(execLog));
            ForthicRuntimeService service = new ForthicRuntimeService(
                    registry, importedModules(registry), parent.config().timezone(), requestTimeoutMs, log);
            RuntimeServer server = new RuntimeServer(service, bind, port, workers);
            Runtime.getRuntime().addShutdownHook(new Thread(server::close, "forthic-shutdown-hook"));
            server.start();
            System.out.println("Forthic runtime listening on http://" + server.address() + RuntimeServer.BASE_PATH
                    + " modules=" + registry.names());
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "remote-call", description = "Execute words on a remote runtime")
    static final class RemoteCallCommand implements Callable<Integer> {
        @Option(names = {"--address"}, required = true, description = "Remote runtime host:port or URL")
        String address;

        @Parameters(arity = "1..*", description = "Word names, run in order against one stack")
        List<String> words;

        @Option(names = {"--stack"}, defaultValue = "[]", description = "Initial stack as a JSON array of wire values")
        String stack;

        @Override
        public Integer call() {
            List<RuntimeValue> initial;
            try {
                JsonNode node = Jsons.readTree(stack);
                initial = WireCodec.decodeStack(node);
            } catch (IllegalArgumentException e) {
                System.err.println("ERROR invalid --stack: " + e.getMessage());
                return 2;
            }
            RuntimeClient client = new RuntimeClient(address);
            try {
                List<RuntimeValue> result = words.size() == 1
                        ? client.executeWord(words.get(0), initial)
                        : client.executeSequence(words, initial);
                System.out.println(Jsons.toJson(WireCodec.encodeStack(result)));
                return 0;
            } catch (RemoteExecutionException e) {
                return fail(e);
            }
        }
    }

    @Command(name = "remote-modules", description = "List the modules of a remote runtime")
    static final class RemoteModulesCommand implements Callable<Integer> {
        @Option(names = {"--address"}, required = true, description = "Remote runtime host:port or URL")
        String address;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(WireCodec.encodeModules(new RuntimeClient(address).listModules())));
                return 0;
            } catch (RemoteExecutionException e) {
                return fail(e);
            }
        }
    }
}
