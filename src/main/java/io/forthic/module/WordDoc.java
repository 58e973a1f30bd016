package io.forthic.module;

public record WordDoc(String name, String stackEffect, String description) {
}
