package net.spookly.livecheck;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LivecheckMainTest {
    @Test
    void parsesOptions() {
        LivecheckMain.CliOptions options = LivecheckMain.parseArgs(new String[] {
                "-c", "conf/check.yaml", "--target", "127.0.0.1:80", "-t", "[::1]:81", "--dry-run"
        });

        assertEquals(Paths.get("conf/check.yaml"), options.configPath());
        assertEquals(List.of("127.0.0.1:80", "[::1]:81"), options.targets());
        assertTrue(options.dryRun());
        assertFalse(options.printEffectiveConfig());
    }

    @Test
    void warnsAboutOptionWithoutValue() {
        Logger logger = (Logger) LoggerFactory.getLogger(LivecheckMain.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        LivecheckMain.CliOptions options;
        try {
            options = LivecheckMain.parseArgs(new String[] {"--dry-run", "--target"});
        } finally {
            logger.detachAppender(appender);
        }

        assertTrue(options.targets().isEmpty());
        assertTrue(options.dryRun());
        assertEquals(1, appender.list.size());
        assertEquals(Level.WARN, appender.list.get(0).getLevel());
        assertEquals("Ignoring --target without a value", appender.list.get(0).getFormattedMessage());
    }

    @Test
    void dryRunValidatesConfigOnly() throws IOException {
        Path configPath = writeConfig("""
                checks:
                  targets:
                    - 127.0.0.1:9
                """);

        assertEquals(LivecheckMain.EXIT_OK, LivecheckMain.run(new String[] {"--config", configPath.toString(), "--dry-run"}));
    }

    @Test
    void invalidConfigExitsWithConfigError() throws IOException {
        Path configPath = writeConfig("""
                probe:
                  intervalMs: -1
                """);

        assertEquals(LivecheckMain.EXIT_CONFIG, LivecheckMain.run(new String[] {"--config", configPath.toString()}));
    }

    @Test
    void missingTargetsExitWithConfigError() throws IOException {
        Path configPath = writeConfig("""
                audit:
                  enabled: false
                """);

        assertEquals(LivecheckMain.EXIT_CONFIG, LivecheckMain.run(new String[] {"--config", configPath.toString()}));
    }

    @Test
    void succeedsWhenTargetIsLive() throws IOException {
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getByName("127.0.0.1"))) {
            Path configPath = writeConfig("""
                    checks:
                      waitTimeoutMs: 5000
                    """);

            int exitCode = LivecheckMain.run(new String[] {
                    "--config", configPath.toString(), "--target", "127.0.0.1:" + server.getLocalPort()
            });

            assertEquals(LivecheckMain.EXIT_OK, exitCode);
        }
    }

    @Test
    void failsWhenWaitTimeoutExpires() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
            port = socket.getLocalPort();
        }
        Path configPath = writeConfig("""
                probe:
                  intervalMs: 50
                checks:
                  waitTimeoutMs: 300
                  targets:
                    - 127.0.0.1:%d
                """.formatted(port));

        assertEquals(LivecheckMain.EXIT_NOT_LIVE, LivecheckMain.run(new String[] {"--config", configPath.toString()}));
    }

    @Test
    void malformedCommandLineTargetFails() throws IOException {
        Path configPath = writeConfig("""
                checks:
                  waitTimeoutMs: 5000
                """);

        int exitCode = LivecheckMain.run(new String[] {"--config", configPath.toString(), "--target", "localhost:80"});

        assertEquals(LivecheckMain.EXIT_NOT_LIVE, exitCode);
    }

    private static Path writeConfig(String yaml) throws IOException {
        Path configPath = Files.createTempFile("livecheck", ".yaml");
        Files.writeString(configPath, yaml, StandardCharsets.UTF_8);
        return configPath;
    }
}
