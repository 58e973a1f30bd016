package io.forthic.runtime;

import io.forthic.error.ExtraSemicolonException;
import io.forthic.error.ForthicException;
import io.forthic.error.InvalidVariableNameException;
import io.forthic.error.MissingSemicolonException;
import io.forthic.error.ModuleImportException;
import io.forthic.error.ModuleLoadException;
import io.forthic.error.RecursionDepthException;
import io.forthic.error.StackUnderflowException;
import io.forthic.error.TooManyAttemptsException;
import io.forthic.error.UnknownWordException;
import io.forthic.model.RuntimeValue;
import io.forthic.model.RuntimeValues;
import io.forthic.module.DefinitionWord;
import io.forthic.module.Module;
import io.forthic.module.ModuleImport;
import io.forthic.module.ModuleRegistry;
import io.forthic.module.PushValueWord;
import io.forthic.module.Variable;
import io.forthic.module.Word;
import io.forthic.module.WordOptions;
import io.forthic.token.CodeLocation;
import io.forthic.token.Token;
import io.forthic.token.TokenType;
import io.forthic.token.Tokenizer;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Executes Forthic source against one operand stack.
 *
 * <p>An interpreter is confined to one thread. It reads modules from a shared,
 * read-only {@link ModuleRegistry} and keeps everything it creates (inline modules,
 * variables of shared modules, the stack, profiling data) to itself.
 */
public class Interpreter {
    public static final String APP_MODULE_NAME = "";
    public static final int DEFAULT_MAX_DEFINITION_DEPTH = 400;

    private final ModuleRegistry sharedModules;
    private final Map<String, Module> localModules = new LinkedHashMap<>();
    private final Map<Module, Map<String, Variable>> variableOverlays = new IdentityHashMap<>();
    private final List<LiteralHandler> literalHandlers = new ArrayList<>();
    private final List<Module> moduleStack = new ArrayList<>();
    private final Deque<Integer> arrayMarks = new ArrayDeque<>();
    private final ProfileLog profileLog = new ProfileLog();
    private final Module appModule;
    private OperandStack stack = new OperandStack();
    private ZoneId timezone;
    private ForthicException lastError;
    private RecoveryHandler recoveryHandler;
    private int maxAttempts = 3;
    private int runDepth;
    private int definitionDepth;
    private int maxDefinitionDepth = DEFAULT_MAX_DEFINITION_DEPTH;

    public Interpreter() {
        this(new ModuleRegistry(), ZoneOffset.UTC);
    }

    public Interpreter(ModuleRegistry sharedModules, ZoneId timezone) {
        this.sharedModules = sharedModules == null ? new ModuleRegistry() : sharedModules;
        this.timezone = timezone == null ? ZoneOffset.UTC : timezone;
        this.appModule = new Module(APP_MODULE_NAME, "Application module");
        this.moduleStack.add(appModule);
        literalHandlers.add(Literals.BOOLEAN);
        literalHandlers.add(Literals.INTEGER);
        literalHandlers.add(Literals.FLOAT_NUMBER);
        literalHandlers.add(Literals.zonedDateTime(this::timezone));
        literalHandlers.add(Literals.plainDate(this::timezone));
    }

    // ----- execution

    public void run(String source) {
        run(source, null);
    }

    /**
     * Runs {@code source} in the current module context. A failure leaves the operand
     * stack as it was at the failing word; when the outermost run fails, pending array
     * marks and module frames opened by the source are discarded.
     */
    public void run(String source, CodeLocation reference) {
        Tokenizer tokenizer = new Tokenizer(source, reference);
        boolean topLevel = runDepth == 0;
        int moduleDepth = moduleStack.size();
        int markDepth = arrayMarks.size();
        runDepth++;
        try {
            if (topLevel && recoveryHandler != null) {
                runWithRecovery(tokenizer);
            } else {
                executeTokens(tokenizer::nextToken, tokenizer.input());
            }
        } catch (ForthicException e) {
            lastError = e;
            if (topLevel) {
                truncateModuleStack(moduleDepth);
                while (arrayMarks.size() > markDepth) {
                    arrayMarks.pop();
                }
            }
            throw e;
        } finally {
            runDepth--;
        }
    }

    private void runWithRecovery(Tokenizer tokenizer) {
        int attempts = 0;
        while (true) {
            try {
                executeTokens(tokenizer::nextToken, tokenizer.input());
                return;
            } catch (ForthicException e) {
                attempts++;
                if (attempts > maxAttempts) {
                    throw new TooManyAttemptsException(maxAttempts, e);
                }
                recoveryHandler.recover(e, this);
            }
        }
    }

    /**
     * Dispatches one resolved word, recording it in the profile log when profiling.
     */
    public void dispatch(Word word) {
        if (word.profiled()) {
            profileLog.countWord(word.qualifiedName());
        }
        word.execute(this);
    }

    public void executeDefinition(DefinitionWord definition) {
        if (definitionDepth >= maxDefinitionDepth) {
            throw new RecursionDepthException(definition.qualifiedName(), maxDefinitionDepth);
        }
        Module owner = definition.module();
        int depth = moduleStack.size();
        boolean pushOwner = owner != null && owner != curModule();
        if (pushOwner) {
            moduleStack.add(owner);
        }
        Iterator<Token> body = definition.body().iterator();
        Token end = new Token(TokenType.EOS, "", definition.location());
        definitionDepth++;
        try {
            executeTokens(() -> body.hasNext() ? body.next() : end, definition.source());
        } catch (ForthicException e) {
            String where = definition.location() == null ? "" : " at " + definition.location().describe();
            e.addFrame("in " + definition.qualifiedName() + where);
            throw e;
        } catch (StackOverflowError e) {
            // Thread stacks smaller than the depth limit assumes.
            throw new RecursionDepthException(definition.qualifiedName(), e);
        } finally {
            definitionDepth--;
            if (pushOwner && moduleStack.size() > depth && moduleStack.get(depth) == owner) {
                moduleStack.remove(depth);
            }
        }
    }

    /**
     * Runs a module's Forthic source once with the module current, as done when the
     * module is registered.
     */
    public void runModuleCode(Module module) {
        if (module.forthicCode().isBlank()) {
            return;
        }
        int depth = moduleStack.size();
        moduleStack.add(module);
        try {
            run(module.forthicCode(), CodeLocation.of(module.name()));
        } catch (ForthicException e) {
            throw new ModuleLoadException(module.name(), e.getMessage(), e);
        } finally {
            truncateModuleStack(depth);
        }
    }

    private void executeTokens(TokenSource tokens, String source) {
        while (true) {
            Token token = tokens.next();
            if (token.isEos()) {
                return;
            }
            try {
                handleToken(token, tokens, source);
            } catch (ForthicException e) {
                e.attachLocation(source, token.location());
                throw e;
            }
        }
    }

    private void handleToken(Token token, TokenSource tokens, String source) {
        switch (token.type()) {
            case STRING, DOT_SYMBOL -> push(RuntimeValue.ofString(token.text()));
            case COMMENT, EOS -> {
            }
            case START_ARRAY -> arrayMarks.push(stack.size());
            case END_ARRAY -> endArray();
            case START_MODULE -> startModule(token.text());
            case END_MODULE -> endModule();
            case START_DEF -> define(token, tokens, source, false);
            case START_MEMO -> define(token, tokens, source, true);
            case END_DEF -> throw new ExtraSemicolonException(source, token.location());
            case WORD -> dispatch(findWord(token.text(), source, token.location()));
        }
    }

    private void endArray() {
        if (arrayMarks.isEmpty()) {
            throw new ForthicException("Unmatched ']' with no open array");
        }
        int mark = arrayMarks.pop();
        push(RuntimeValue.array(stack.popFrom(mark)));
    }

    private void define(Token start, TokenSource tokens, String source, boolean memo) {
        List<Token> body = new ArrayList<>();
        while (true) {
            Token token = tokens.next();
            if (token.isEos() || token.type() == TokenType.START_DEF || token.type() == TokenType.START_MEMO) {
                throw new MissingSemicolonException(start.text(), source, token.location());
            }
            if (token.type() == TokenType.END_DEF) {
                break;
            }
            body.add(token);
        }
        DefinitionWord definition = new DefinitionWord(start.text(), body, source, start.location());
        if (memo) {
            curModule().addMemoWords(definition);
        } else {
            curModule().addWord(definition);
        }
    }

    // ----- word resolution

    public Word findWord(String name) {
        return findWord(name, null, null);
    }

    /**
     * Scans the module stack from the top: each module's own words, then its variables,
     * then the exported words of its imports, most recent import first. Literal handlers
     * are consulted last.
     */
    public Word findWord(String name, String source, CodeLocation location) {
        for (int i = moduleStack.size() - 1; i >= 0; i--) {
            Module module = moduleStack.get(i);
            Optional<Word> word = module.findDictionaryWord(name);
            if (word.isPresent()) {
                return word.get();
            }
            Optional<Variable> variable = findVariable(module, name);
            if (variable.isPresent()) {
                return new PushValueWord(name, new RuntimeValue.VariableRef(variable.get()));
            }
            word = module.findImportedWord(name);
            if (word.isPresent()) {
                return word.get();
            }
        }
        Optional<RuntimeValue> literal = parseLiteral(name);
        if (literal.isPresent()) {
            return new PushValueWord(name, literal.get());
        }
        throw new UnknownWordException(name, scopeChain(), source, location);
    }

    public Optional<RuntimeValue> parseLiteral(String text) {
        for (LiteralHandler handler : literalHandlers) {
            Optional<RuntimeValue> value = handler.parse(text);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private List<String> scopeChain() {
        Set<String> chain = new LinkedHashSet<>();
        for (int i = moduleStack.size() - 1; i >= 0; i--) {
            Module module = moduleStack.get(i);
            chain.add(label(module));
            List<ModuleImport> imports = module.imports();
            for (int j = imports.size() - 1; j >= 0; j--) {
                chain.add(label(imports.get(j).module()));
            }
        }
        return new ArrayList<>(chain);
    }

    private static String label(Module module) {
        return module.name().isEmpty() ? "<app>" : module.name();
    }

    public void registerLiteralHandler(LiteralHandler handler) {
        literalHandlers.add(handler);
    }

    public void unregisterLiteralHandler(LiteralHandler handler) {
        literalHandlers.remove(handler);
    }

    // ----- modules

    public Module appModule() {
        return appModule;
    }

    public Module curModule() {
        return moduleStack.get(moduleStack.size() - 1);
    }

    public void pushModule(Module module) {
        moduleStack.add(module);
    }

    public Module popModule() {
        if (moduleStack.size() <= 1) {
            throw new ForthicException("Cannot pop the application module");
        }
        return moduleStack.remove(moduleStack.size() - 1);
    }

    public List<Module> moduleStack() {
        return List.copyOf(moduleStack);
    }

    private void startModule(String name) {
        if (name.isEmpty()) {
            moduleStack.add(appModule);
            return;
        }
        Module module = localModules.get(name);
        if (module == null) {
            module = new Module(name);
            registerModule(module);
        }
        moduleStack.add(module);
    }

    private void endModule() {
        popModule();
    }

    private void truncateModuleStack(int depth) {
        while (moduleStack.size() > Math.max(depth, 1)) {
            moduleStack.remove(moduleStack.size() - 1);
        }
    }

    /**
     * Registers a module visible only to this interpreter. Local modules shadow shared
     * modules of the same name.
     */
    public void registerModule(Module module) {
        localModules.put(module.name(), module);
    }

    public Module findModule(String name) {
        Module local = localModules.get(name);
        if (local != null) {
            return local;
        }
        return sharedModules.find(name).orElseThrow(() -> new ModuleImportException(name));
    }

    public ModuleRegistry sharedModules() {
        return sharedModules;
    }

    public void useModule(String name, String prefix) {
        curModule().addImport(findModule(name), prefix);
    }

    /**
     * Imports each entry of {@code specs}: a module name, or a {@code [name prefix]} pair.
     */
    public void useModules(List<RuntimeValue> specs) {
        for (RuntimeValue spec : specs) {
            if (spec.kind() == RuntimeValue.Kind.ARRAY) {
                RuntimeValue.ArrayValue pair = (RuntimeValue.ArrayValue) spec;
                if (pair.size() != 2) {
                    throw new IllegalArgumentException("module spec must be [name prefix], got " + pair.size() + " items");
                }
                useModule(RuntimeValues.requireString(pair.get(0), "module name"),
                        RuntimeValues.requireString(pair.get(1), "module prefix"));
            } else {
                useModule(RuntimeValues.requireString(spec, "module name"), "");
            }
        }
    }

    /**
     * Registers {@code module} locally and imports it into the application module.
     */
    public void importModule(Module module, String prefix) {
        registerModule(module);
        appModule.addImport(module, prefix);
    }

    // ----- variables

    /**
     * Variables of shared modules are copied into this interpreter on first use, so
     * writes never reach the shared module.
     */
    public Optional<Variable> findVariable(Module module, String name) {
        if (!module.isFrozen()) {
            return module.findVariable(name);
        }
        Map<String, Variable> overlay = variableOverlays.get(module);
        if (overlay != null && overlay.containsKey(name)) {
            return Optional.of(overlay.get(name));
        }
        return module.findVariable(name).map(shared -> overlayFor(module).computeIfAbsent(name, key -> shared.copy()));
    }

    public Variable declareVariable(String name) {
        if (name.startsWith("__")) {
            throw new InvalidVariableNameException(name);
        }
        Module module = curModule();
        if (!module.isFrozen()) {
            return module.addVariable(name);
        }
        return findVariable(module, name).orElseGet(() -> overlayFor(module).computeIfAbsent(name, Variable::new));
    }

    private Map<String, Variable> overlayFor(Module module) {
        return variableOverlays.computeIfAbsent(module, key -> new LinkedHashMap<>());
    }

    // ----- stack

    public void push(RuntimeValue value) {
        stack.push(value);
    }

    public RuntimeValue pop() {
        if (stack.isEmpty()) {
            throw new StackUnderflowException("Stack underflow");
        }
        return stack.pop();
    }

    public RuntimeValue peek() {
        if (stack.isEmpty()) {
            throw new StackUnderflowException("Stack underflow");
        }
        return stack.peek();
    }

    /**
     * Pops {@code count} values and returns them in the order they were pushed.
     */
    public List<RuntimeValue> popInputs(int count) {
        if (stack.size() < count) {
            throw new StackUnderflowException("Stack underflow: expected " + count + " item(s), found " + stack.size());
        }
        return stack.popFrom(stack.size() - count);
    }

    public WordOptions popOptionsIfPresent() {
        if (!stack.isEmpty() && stack.peek().kind() == RuntimeValue.Kind.OPTIONS) {
            return ((RuntimeValue.OptionsValue) stack.pop()).options();
        }
        return WordOptions.EMPTY;
    }

    public int stackSize() {
        return stack.size();
    }

    public List<RuntimeValue> stackItems() {
        return stack.items();
    }

    public void replaceStack(List<RuntimeValue> values) {
        OperandStack replacement = new OperandStack();
        replacement.pushAll(values);
        stack = replacement;
    }

    /**
     * Clears the stack, the application module's variables and the module stack.
     */
    public void reset() {
        stack = new OperandStack();
        appModule.clearVariables();
        truncateModuleStack(1);
        arrayMarks.clear();
        definitionDepth = 0;
        lastError = null;
    }

    // ----- misc state

    public ProfileLog profileLog() {
        return profileLog;
    }

    public ZoneId timezone() {
        return timezone;
    }

    public void setTimezone(ZoneId timezone) {
        this.timezone = timezone;
    }

    public Optional<ForthicException> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Installs a handler consulted when a top-level run fails. After the handler returns,
     * execution resumes with the token after the one that failed; more than
     * {@code maxAttempts} failures in one run end it with {@link TooManyAttemptsException}.
     */
    public void setRecoveryHandler(RecoveryHandler handler, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.recoveryHandler = handler;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Limits how deeply definitions may call definitions; deeper calls fail with
     * {@link RecursionDepthException}.
     */
    public void setMaxDefinitionDepth(int maxDefinitionDepth) {
        if (maxDefinitionDepth < 1) {
            throw new IllegalArgumentException("maxDefinitionDepth must be >= 1");
        }
        this.maxDefinitionDepth = maxDefinitionDepth;
    }

    @FunctionalInterface
    private interface TokenSource {
        Token next();
    }
}
