package net.spookly.livecheck;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import lombok.extern.slf4j.Slf4j;
import net.spookly.livecheck.config.ConfigException;
import net.spookly.livecheck.config.ConfigLoader;
import net.spookly.livecheck.config.ConfigPrinter;
import net.spookly.livecheck.config.LivecheckConfig;
import net.spookly.livecheck.probe.ProbeAuditLogger;
import net.spookly.livecheck.probe.ProbeDispatcher;
import net.spookly.livecheck.probe.ProbeEventListener;
import net.spookly.livecheck.probe.ProbeScope;

/**
 * Standalone entry point that waits until every configured address accepts TCP connections.
 */
@Slf4j
public final class LivecheckMain {
    static final int EXIT_OK = 0;
    static final int EXIT_NOT_LIVE = 1;
    static final int EXIT_CONFIG = 2;

    private static final String DEFAULT_CONFIG = "config/livecheck.yaml";

    private LivecheckMain() {
    }

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args) {
        CliOptions options = parseArgs(args);
        LivecheckConfig config;
        try {
            config = ConfigLoader.load(options.configPath());
        } catch (ConfigException e) {
            log.error(e.getMessage());
            return EXIT_CONFIG;
        }
        if (options.printEffectiveConfig()) {
            System.out.println(ConfigPrinter.toYaml(config));
            return EXIT_OK;
        }
        if (options.dryRun()) {
            System.out.println("Config OK (--dry-run).");
            return EXIT_OK;
        }
        List<String> targets = options.targets().isEmpty() ? configuredTargets(config) : options.targets();
        if (targets.isEmpty()) {
            log.error("No targets to check: pass --target or set checks.targets");
            return EXIT_CONFIG;
        }

        ProbeEventListener eventListener = ProbeEventListener.NOOP;
        if (config.audit != null && Boolean.TRUE.equals(config.audit.enabled)) {
            eventListener = ProbeAuditLogger.INSTANCE;
        }
        try (ProbeDispatcher dispatcher = ProbeDispatcher.fromConfig(config, eventListener)) {
            ProbeScope scope = checkScope(dispatcher, config);
            Thread shutdownHook = new Thread(scope::cancel, "livecheck-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);
            try {
                return awaitTargets(dispatcher, scope, targets);
            } finally {
                removeShutdownHook(shutdownHook);
            }
        }
    }

    private static int awaitTargets(ProbeDispatcher dispatcher, ProbeScope scope, List<String> targets) {
        List<CompletableFuture<Void>> pending = new ArrayList<>(targets.size());
        for (int i = 0; i < targets.size(); i++) {
            pending.add(dispatcher.startProbeAsync(scope, i + 1L, targets.get(i)));
        }
        boolean allLive = true;
        for (int i = 0; i < targets.size(); i++) {
            String target = targets.get(i);
            try {
                pending.get(i).join();
                log.info("{} is live", target);
            } catch (CompletionException e) {
                allLive = false;
                Throwable cause = e.getCause() == null ? e : e.getCause();
                log.warn("{} did not become live: {}", target, cause.getMessage());
            }
        }
        return allLive ? EXIT_OK : EXIT_NOT_LIVE;
    }

    private static ProbeScope checkScope(ProbeDispatcher dispatcher, LivecheckConfig config) {
        Integer waitTimeoutMs = config.checks == null ? null : config.checks.waitTimeoutMs;
        if (waitTimeoutMs == null) {
            return dispatcher.baseScope().child();
        }
        return dispatcher.baseScope().withTimeout(Duration.ofMillis(waitTimeoutMs));
    }

    private static List<String> configuredTargets(LivecheckConfig config) {
        if (config.checks == null || config.checks.targets == null) {
            return List.of();
        }
        List<String> targets = new ArrayList<>();
        for (String target : config.checks.targets) {
            targets.add(target.trim());
        }
        return targets;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown in progress, shutdown hook stays registered");
        }
    }

    static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        List<String> targets = new ArrayList<>();
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig, targets);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                } else {
                    log.warn("Ignoring {} without a value", arg);
                }
                continue;
            }
            if ("--target".equals(arg) || "-t".equals(arg)) {
                if (i + 1 < args.length) {
                    targets.add(args[++i]);
                } else {
                    log.warn("Ignoring {} without a value", arg);
                }
                continue;
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig, List.copyOf(targets));
    }

    record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig, List<String> targets) {
    }
}
