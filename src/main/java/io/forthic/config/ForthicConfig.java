package io.forthic.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;

public final class ForthicConfig {
    public static final String MODULES_CONFIG_ENV = "FORTHIC_MODULES_CONFIG";
    public static final String DEFAULT_BIND = "127.0.0.1";
    public static final int DEFAULT_PORT = 50051;
    public static final String DEFAULT_TIMEZONE = "UTC";
    public static final long DEFAULT_REQUEST_TIMEOUT_MS = 0L;
    public static final int DEFAULT_WORKER_THREADS = 8;

    private final Path modulesConfig;
    private final ZoneId timezone;

    public ForthicConfig(Path modulesConfig, ZoneId timezone) {
        this.modulesConfig = modulesConfig;
        this.timezone = timezone;
    }

    public static ForthicConfig defaults() {
        return fromOptions(null, null);
    }

    /**
     * @param modulesConfig path to the module list; blank means no configured modules
     * @param timezone IANA zone id; blank means {@link #DEFAULT_TIMEZONE}
     */
    public static ForthicConfig fromOptions(String modulesConfig, String timezone) {
        Path configPath = modulesConfig == null || modulesConfig.isBlank()
                ? null
                : Paths.get(modulesConfig.trim()).toAbsolutePath().normalize();
        return new ForthicConfig(configPath, parseZone(timezone));
    }

    private static ZoneId parseZone(String raw) {
        String zone = raw == null || raw.isBlank() ? DEFAULT_TIMEZONE : raw.trim();
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid timezone: " + zone, e);
        }
    }

    public Path modulesConfig() {
        return modulesConfig;
    }

    public boolean hasModulesConfig() {
        return modulesConfig != null;
    }

    public ZoneId timezone() {
        return timezone;
    }
}
