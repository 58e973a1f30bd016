package io.forthic.config;

import io.forthic.module.Module;

public interface ModuleFactory {
    Module create() throws Exception;
}
