package io.forthic.module;

import io.forthic.error.IntentionalStopException;
import io.forthic.runtime.Interpreter;
import io.forthic.token.CodeLocation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public abstract class Word {
    private final String name;
    private final String stackEffect;
    private final String description;
    private final List<WordErrorHandler> errorHandlers = new CopyOnWriteArrayList<>();
    private CodeLocation location;
    private Module module;

    protected Word(String name) {
        this(name, "", "");
    }

    protected Word(String name, String stackEffect, String description) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("word name must not be empty");
        }
        this.name = name;
        this.stackEffect = stackEffect == null ? "" : stackEffect;
        this.description = description == null ? "" : description;
    }

    public final void execute(Interpreter interp) {
        try {
            run(interp);
        } catch (IntentionalStopException e) {
            throw e;
        } catch (RuntimeException e) {
            if (!tryErrorHandlers(e, interp)) {
                throw e;
            }
        }
    }

    protected abstract void run(Interpreter interp);

    private boolean tryErrorHandlers(RuntimeException error, Interpreter interp) {
        for (WordErrorHandler handler : errorHandlers) {
            try {
                handler.handle(error, this, interp);
                return true;
            } catch (Exception handlerError) {
                error.addSuppressed(handlerError);
            }
        }
        return false;
    }

    /**
     * Whether a dispatch of this word is recorded while profiling. Literal pushes and memo
     * cache reads are not.
     */
    public boolean profiled() {
        return true;
    }

    public String name() {
        return name;
    }

    public String stackEffect() {
        return stackEffect;
    }

    public String description() {
        return description;
    }

    public CodeLocation location() {
        return location;
    }

    public void setLocation(CodeLocation location) {
        this.location = location;
    }

    public Module module() {
        return module;
    }

    void attachTo(Module owner) {
        if (module == null) {
            module = owner;
        }
    }

    public String qualifiedName() {
        if (module == null || module.name().isEmpty()) {
            return name;
        }
        return module.name() + "." + name;
    }

    public WordDoc doc() {
        return new WordDoc(name, stackEffect, description);
    }

    public void addErrorHandler(WordErrorHandler handler) {
        errorHandlers.add(handler);
    }

    public void removeErrorHandler(WordErrorHandler handler) {
        errorHandlers.remove(handler);
    }

    public List<WordErrorHandler> errorHandlers() {
        return List.copyOf(errorHandlers);
    }

    @Override
    public String toString() {
        return "Word[" + qualifiedName() + "]";
    }
}
