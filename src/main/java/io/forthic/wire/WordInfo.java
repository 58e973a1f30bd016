package io.forthic.wire;

public record WordInfo(String name, String stackEffect, String description) {
}
