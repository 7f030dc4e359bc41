package net.spookly.livecheck.config;

import java.util.List;

public class LivecheckConfig {
    public ProbeConfig probe;
    public ChecksConfig checks;
    public AuditConfig audit;

    public static class ProbeConfig {
        /**
         * Delay between connection attempts for a single probe.
         */
        public Integer intervalMs;
        /**
         * Minimum delay between two "checking address" log lines of the same probe.
         */
        public Integer logIntervalMs;
        /**
         * Optional cap on a single connection attempt. Attempts are always bounded by cancellation.
         */
        public Integer connectTimeoutMs;
        public Integer workerThreads;
    }

    public static class ChecksConfig {
        public Integer waitTimeoutMs;
        public List<String> targets;
    }

    public static class AuditConfig {
        public Boolean enabled;
    }
}
