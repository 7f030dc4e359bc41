package net.spookly.livecheck.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    public static final int DEFAULT_INTERVAL_MS = 100;
    public static final int DEFAULT_LOG_INTERVAL_MS = 1000;

    private static final String DEFAULT_YAML_TEMPLATE = """
            # Generated default livecheck config.
            probe:
              intervalMs: %d
              logIntervalMs: %d
              connectTimeoutMs: 1000
              workerThreads: 4

            checks:
              waitTimeoutMs: 60000
              targets:
                - %s

            audit:
              enabled: true
            """;

    private ConfigDefaults() {
    }

    /**
     * Render the default configuration template with a single target.
     */
    public static String defaultYaml(String target) {
        if (target == null || target.isBlank()) {
            throw new ConfigException("Target address is required for the default config");
        }
        return DEFAULT_YAML_TEMPLATE.formatted(DEFAULT_INTERVAL_MS, DEFAULT_LOG_INTERVAL_MS, target);
    }
}
