package io.forthic.bridge;

import io.forthic.error.RemoteExecutionException;
import io.forthic.model.RuntimeValue;
import io.forthic.module.Word;
import io.forthic.runtime.Interpreter;

import java.util.List;

/**
 * Proxy for a word that lives in another runtime. The whole local stack is sent along
 * and replaced by the stack the remote runtime returns.
 */
public final class RemoteWord extends Word {
    private final RuntimeClient client;
    private final String remoteModule;

    public RemoteWord(String name, String stackEffect, String description, RuntimeClient client, String remoteModule) {
        super(name, stackEffect, description);
        this.client = client;
        this.remoteModule = remoteModule;
    }

    public String remoteModule() {
        return remoteModule;
    }

    @Override
    protected void run(Interpreter interp) {
        List<RuntimeValue> result;
        try {
            result = client.executeWord(name(), interp.stackItems());
        } catch (RemoteExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteExecutionException("Remote word " + remoteModule + "." + name()
                    + " on " + client.address() + " failed: " + e.getMessage(), null, e);
        }
        interp.replaceStack(result);
    }
}
