package io.forthic.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.forthic.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public record ModuleConfig(String name, String importPath, boolean optional, String description) {
    public ModuleConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("module name must not be empty");
        }
        if (importPath == null || importPath.isBlank()) {
            throw new IllegalArgumentException("import_path must not be empty for module '" + name + "'");
        }
        description = description == null ? "" : description;
    }

    public static List<ModuleConfig> read(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("modules config not found: " + file);
        }
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public static List<ModuleConfig> parse(String raw) {
        JsonNode root = Jsons.readTree(raw);
        JsonNode modules = root.path("modules");
        if (!modules.isArray()) {
            throw new IllegalArgumentException("modules config must contain a \"modules\" array");
        }
        List<ModuleConfig> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode entry : modules) {
            ModuleConfig config = new ModuleConfig(
                    entry.path("name").asText(""),
                    entry.path("import_path").asText(""),
                    entry.path("optional").asBoolean(false),
                    entry.path("description").asText("")
            );
            if (!seen.add(config.name())) {
                throw new IllegalArgumentException("duplicate module name in config: " + config.name());
            }
            out.add(config);
        }
        return out;
    }
}
