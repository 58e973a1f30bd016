package io.forthic.module;

import io.forthic.error.ForthicException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class Module {
    private final String name;
    private final String description;
    private final String forthicCode;
    private final Map<String, Word> words = new LinkedHashMap<>();
    private final Set<String> exportable = new LinkedHashSet<>();
    private final Map<String, Variable> variables = new LinkedHashMap<>();
    private final List<ModuleImport> imports = new ArrayList<>();
    private boolean runtimeSpecific;
    private volatile boolean frozen;

    public Module(String name) {
        this(name, "", "");
    }

    public Module(String name, String description) {
        this(name, description, "");
    }

    public Module(String name, String description, String forthicCode) {
        if (name == null) {
            throw new IllegalArgumentException("module name must not be null");
        }
        this.name = name;
        this.description = description == null ? "" : description;
        this.forthicCode = forthicCode == null ? "" : forthicCode;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    /**
     * Forthic source run once with this module current when it is registered.
     */
    public String forthicCode() {
        return forthicCode;
    }

    public boolean isRuntimeSpecific() {
        return runtimeSpecific;
    }

    public void setRuntimeSpecific(boolean runtimeSpecific) {
        checkMutable();
        this.runtimeSpecific = runtimeSpecific;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public void freeze() {
        frozen = true;
    }

    public <W extends Word> W addWord(W word) {
        checkMutable();
        words.remove(word.name());
        words.put(word.name(), word);
        word.attachTo(this);
        return word;
    }

    public <W extends Word> W addExportableWord(W word) {
        addWord(word);
        exportable.add(word.name());
        return word;
    }

    public NativeWord addNativeWord(String wordName, String stackEffect, String wordDescription, NativeImpl impl) {
        return addExportableWord(WordBinding.of(wordName, stackEffect, wordDescription, impl).toWord());
    }

    public DirectWord addDirectWord(String wordName, String stackEffect, String wordDescription, DirectImpl impl) {
        return addExportableWord(new DirectWord(wordName, stackEffect, wordDescription, impl));
    }

    /**
     * Registers a memo word for {@code definition} together with its {@code NAME!} and
     * {@code NAME!@} companions.
     */
    public MemoWord addMemoWords(DefinitionWord definition) {
        checkMutable();
        definition.attachTo(this);
        MemoWord memo = addWord(new MemoWord(definition));
        addWord(new MemoRefreshWord(memo, false));
        addWord(new MemoRefreshWord(memo, true));
        return memo;
    }

    public void addExportable(Collection<String> names) {
        checkMutable();
        exportable.addAll(names);
    }

    public Optional<Word> findDictionaryWord(String wordName) {
        return Optional.ofNullable(words.get(wordName));
    }

    public Optional<Word> findExportedWord(String wordName) {
        if (!exportable.contains(wordName)) {
            return Optional.empty();
        }
        return findDictionaryWord(wordName);
    }

    /**
     * Exported words of the modules imported here, most recent import first.
     */
    public Optional<Word> findImportedWord(String wordName) {
        for (int i = imports.size() - 1; i >= 0; i--) {
            Optional<Word> found = imports.get(i).resolve(wordName);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    public List<Word> words() {
        return List.copyOf(words.values());
    }

    public List<Word> exportableWords() {
        List<Word> result = new ArrayList<>();
        for (Word word : words.values()) {
            if (exportable.contains(word.name())) {
                result.add(word);
            }
        }
        return result;
    }

    public List<WordDoc> wordDocs() {
        List<WordDoc> docs = new ArrayList<>();
        for (Word word : words.values()) {
            docs.add(word.doc());
        }
        return docs;
    }

    public Optional<Variable> findVariable(String variableName) {
        return Optional.ofNullable(variables.get(variableName));
    }

    public Variable addVariable(String variableName) {
        checkMutable();
        return variables.computeIfAbsent(variableName, Variable::new);
    }

    public void clearVariables() {
        checkMutable();
        variables.clear();
    }

    public Map<String, Variable> variables() {
        return Collections.unmodifiableMap(variables);
    }

    public void addImport(Module module, String prefix) {
        checkMutable();
        imports.add(new ModuleImport(module, prefix));
    }

    public List<ModuleImport> imports() {
        return Collections.unmodifiableList(imports);
    }

    private void checkMutable() {
        if (frozen) {
            throw new ForthicException("Module '" + name + "' is read-only after startup");
        }
    }

    @Override
    public String toString() {
        return "Module[" + (name.isEmpty() ? "<app>" : name) + "]";
    }
}
