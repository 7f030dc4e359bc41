package net.spookly.livecheck.config;

import java.util.ArrayList;
import java.util.List;

import net.spookly.livecheck.probe.MalformedAddressException;
import net.spookly.livecheck.util.ProbeAddress;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(LivecheckConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateProbe(config, errors);
        validateChecks(config, errors);

        throwIfErrors(errors);
    }

    private static void validateProbe(LivecheckConfig config, List<String> errors) {
        LivecheckConfig.ProbeConfig probe = config.probe;
        if (probe == null) {
            return;
        }
        optionalPositive(errors, probe.intervalMs, "probe.intervalMs");
        optionalPositive(errors, probe.logIntervalMs, "probe.logIntervalMs");
        optionalPositive(errors, probe.connectTimeoutMs, "probe.connectTimeoutMs");
        optionalPositive(errors, probe.workerThreads, "probe.workerThreads");
    }

    private static void validateChecks(LivecheckConfig config, List<String> errors) {
        LivecheckConfig.ChecksConfig checks = config.checks;
        if (checks == null) {
            return;
        }
        optionalPositive(errors, checks.waitTimeoutMs, "checks.waitTimeoutMs");
        if (checks.targets == null) {
            return;
        }
        for (String target : checks.targets) {
            if (isBlank(target)) {
                errors.add("checks.targets must not include blank entries");
                continue;
            }
            try {
                ProbeAddress.parse(target.trim());
            } catch (MalformedAddressException e) {
                errors.add("checks.targets contains an invalid address: " + e.getMessage());
            }
        }
    }

    private static void optionalPositive(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
