package io.forthic.bridge;

import io.forthic.model.RuntimeValue;
import io.forthic.model.RuntimeValues;
import io.forthic.module.Module;
import io.forthic.runtime.Interpreter;

import java.util.ArrayList;
import java.util.List;

/**
 * Forthic words for connecting to other runtimes and importing their modules.
 *
 * <pre>
 * "python" "localhost:50052" CONNECT-RUNTIME
 * "python" ["pandas"] USE-REMOTE-MODULES
 * </pre>
 */
public class RemoteRuntimeModule extends Module {
    public static final String NAME = "remote_runtime";

    private final RuntimeManager manager;

    public RemoteRuntimeModule() {
        this(new RuntimeManager());
    }

    public RemoteRuntimeModule(RuntimeManager manager) {
        super(NAME, "Connects to remote Forthic runtimes and imports their modules");
        this.manager = manager;
        addDirectWord("CONNECT-RUNTIME", "( name:str address:str -- )",
                "Connects to a remote runtime at host:port under a name", interp -> {
                    String address = RuntimeValues.requireString(interp.pop(), "runtime address");
                    String name = RuntimeValues.requireString(interp.pop(), "runtime name");
                    manager.connect(name, address);
                });
        addDirectWord("DISCONNECT-RUNTIME", "( name:str -- )", "Drops a runtime connection", interp ->
                manager.disconnect(RuntimeValues.requireString(interp.pop(), "runtime name")));
        addNativeWord("LIST-RUNTIMES", "( -- names:list )", "Lists connected runtime names", (inputs, options) -> {
            List<RuntimeValue> names = new ArrayList<>();
            for (String name : manager.listConnections()) {
                names.add(RuntimeValue.ofString(name));
            }
            return RuntimeValue.array(names);
        });
        addDirectWord("USE-REMOTE-MODULES", "( runtime:str modules:list -- )",
                "Imports modules from a connected runtime without a prefix", interp -> {
                    RuntimeValue modules = interp.pop();
                    String runtime = RuntimeValues.requireString(interp.pop(), "runtime name");
                    useRemoteModules(interp, runtime, modules, "");
                });
        addDirectWord("USE-REMOTE-MODULES-AS", "( runtime:str modules:list prefix:str -- )",
                "Imports modules from a connected runtime under a prefix", interp -> {
                    String prefix = RuntimeValues.requireString(interp.pop(), "module prefix");
                    RuntimeValue modules = interp.pop();
                    String runtime = RuntimeValues.requireString(interp.pop(), "runtime name");
                    useRemoteModules(interp, runtime, modules, prefix);
                });
    }

    public RuntimeManager manager() {
        return manager;
    }

    private void useRemoteModules(Interpreter interp, String runtime, RuntimeValue modules, String prefix) {
        RuntimeClient client = manager.find(runtime).orElseThrow(() ->
                new IllegalArgumentException("runtime '" + runtime + "' is not connected; use CONNECT-RUNTIME first"));
        for (RuntimeValue entry : RuntimeValues.requireArray(modules, "module names").items()) {
            String moduleName = RuntimeValues.requireString(entry, "module name");
            RemoteModule module = new RemoteModule(moduleName, runtime, client).initialize();
            interp.registerModule(module);
            interp.useModule(moduleName, prefix);
        }
    }
}
