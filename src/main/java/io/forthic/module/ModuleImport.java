package io.forthic.module;

import java.util.Optional;

public record ModuleImport(Module module, String prefix) {
    public ModuleImport {
        prefix = prefix == null ? "" : prefix;
    }

    public Optional<Word> resolve(String wordName) {
        if (prefix.isEmpty()) {
            return module.findExportedWord(wordName);
        }
        String qualifier = prefix + ".";
        if (!wordName.startsWith(qualifier) || wordName.length() == qualifier.length()) {
            return Optional.empty();
        }
        return module.findExportedWord(wordName.substring(qualifier.length()))
                .map(target -> new PrefixedWord(wordName, target));
    }
}
