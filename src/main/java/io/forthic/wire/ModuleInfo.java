package io.forthic.wire;

import java.util.List;

public record ModuleInfo(String name, String description, List<WordInfo> words) {
    public ModuleInfo {
        words = words == null ? List.of() : List.copyOf(words);
    }
}
