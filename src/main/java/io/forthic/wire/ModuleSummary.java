package io.forthic.wire;

public record ModuleSummary(String name, String description, int wordCount, boolean runtimeSpecific) {
}
