package net.spookly.livecheck.config;

import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration, with probe defaults filled in.
 */
public final class ConfigPrinter {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(LivecheckConfig config) {
        LivecheckConfig effective = withDefaults(config);
        Map<String, Object> data = MAPPER.convertValue(effective, Map.class);
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        return new Yaml(options).dump(data);
    }

    private static LivecheckConfig withDefaults(LivecheckConfig config) {
        LivecheckConfig effective = MAPPER.convertValue(config, LivecheckConfig.class);
        if (effective.probe == null) {
            effective.probe = new LivecheckConfig.ProbeConfig();
        }
        if (effective.probe.intervalMs == null) {
            effective.probe.intervalMs = ConfigDefaults.DEFAULT_INTERVAL_MS;
        }
        if (effective.probe.logIntervalMs == null) {
            effective.probe.logIntervalMs = ConfigDefaults.DEFAULT_LOG_INTERVAL_MS;
        }
        return effective;
    }
}
