package com.kawari.proxy.core.services;

import com.kawari.proxy.config.LoggingConfig;
import com.kawari.proxy.core.services.LoggingService.AccessRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;

class LoggingServiceTest {

    @TempDir
    Path tempDir;

    private LoggingService loggingService;

    @AfterEach
    void tearDown() {
        if (loggingService != null) {
            loggingService.shutdown();
            loggingService = null;
        }
    }

    private static AccessRecord record(String method, String target, int status, long bytes) {
        return new AccessRecord("127.0.0.1", method, target, status, bytes, "agent/1.0", "http://10.0.0.1:3128", 2);
    }

    private LoggingConfig fileConfig(String fileName) {
        LoggingConfig cfg = new LoggingConfig();
        cfg.setFileEnabled(true);
        cfg.setFilePath(tempDir.toString());
        cfg.setFileName(fileName);
        return cfg;
    }

    @Test
    void logRequest_consoleOnly_doesNotThrow() {
        loggingService = new LoggingService(new LoggingConfig());

        assertThatCode(() -> loggingService.logRequest(record("GET", "/", 200, 100)))
                .doesNotThrowAnyException();
        assertThat(tempDir.toFile().listFiles()).isEmpty();
    }

    @Test
    void fileLogging_createsFile() throws IOException {
        loggingService = new LoggingService(fileConfig("test.log"));
        loggingService.logRequest(record("GET", "/http://example.com/", 200, 100));
        loggingService.shutdown();

        Path logFile = tempDir.resolve("test.log");
        assertThat(Files.exists(logFile)).isTrue();
        assertThat(Files.readString(logFile)).contains("GET /http://example.com/ HTTP/1.1");
    }

    @Test
    void format_apacheTokens() {
        loggingService = new LoggingService(new LoggingConfig());

        String line = loggingService.format("%h %l %u %m %q %r %>s %b",
                record("POST", "/api/v1?test=1", 201, 1024));

        assertThat(line).isEqualTo("127.0.0.1 - - POST ?test=1 POST /api/v1?test=1 HTTP/1.1 201 1024");
    }

    @Test
    void format_rotationTokens() {
        loggingService = new LoggingService(new LoggingConfig());

        assertThat(loggingService.format("%i %x %a", record("GET", "/", 200, 0)))
                .isEqualTo("agent/1.0 http://10.0.0.1:3128 2");
        assertThat(loggingService.format("%i %x %a",
                new AccessRecord("::1", "GET", "/", 400, 0, null, null, 0)))
                .isEqualTo("- direct 0");
    }

    @Test
    void format_zeroBytesAndUnknownTokens() {
        loggingService = new LoggingService(new LoggingConfig());

        assertThat(loggingService.format("%b %z 100%", record("GET", "/", 204, 0))).isEqualTo("- %z 100%");
    }

    @Test
    void format_timestampIsBracketed() {
        loggingService = new LoggingService(new LoggingConfig());

        assertThat(loggingService.format("%t", record("GET", "/", 200, 0))).matches("\\[.+\\]");
    }

    @Test
    void fileLogging_rotationBySize() throws IOException {
        LoggingConfig cfg = fileConfig("rotated.log");
        cfg.setRotation("SIZE");
        cfg.setMaxSize("1KB");
        loggingService = new LoggingService(cfg);

        String large = "/".concat("x".repeat(600));
        loggingService.logRequest(record("GET", large, 200, 0));
        loggingService.logRequest(record("GET", large, 200, 0));
        Path logFile = tempDir.resolve("rotated.log");
        await().atMost(Duration.ofSeconds(5)).until(() -> Files.exists(logFile) && Files.size(logFile) >= 1024);

        loggingService.logRequest(record("GET", "/small", 200, 0));
        loggingService.shutdown();

        File[] rotated = tempDir.toFile().listFiles((d, name) -> name.startsWith("rotated.log."));
        assertThat(rotated).hasSize(1);
        assertThat(Files.readString(logFile)).contains("/small").doesNotContain("xxxx");
    }

    @Test
    void fileLogging_cleanupKeepsMaxHistory() throws IOException {
        LoggingConfig cfg = fileConfig("cleanup.log");
        cfg.setRotation("SIZE");
        cfg.setMaxSize("100B");
        cfg.setMaxHistory(2);
        loggingService = new LoggingService(cfg);

        Path logFile = tempDir.resolve("cleanup.log");
        for (int i = 0; i < 5; i++) {
            loggingService.logRequest(record("GET", "/entry-" + i + "-" + "y".repeat(100), 200, 0));
            await().atMost(Duration.ofSeconds(5)).until(() -> Files.exists(logFile) && Files.size(logFile) >= 100);
        }
        loggingService.shutdown();

        File[] archived = tempDir.toFile().listFiles((d, name) -> name.startsWith("cleanup.log."));
        assertThat(archived).hasSizeLessThanOrEqualTo(2);
    }

    @Test
    void fileLogging_dailyRotationWritesCurrentFile() {
        LoggingConfig cfg = fileConfig("daily.log");
        cfg.setRotation("DAILY");
        loggingService = new LoggingService(cfg);

        loggingService.logRequest(record("GET", "/", 200, 100));
        loggingService.shutdown();

        assertThat(Files.exists(tempDir.resolve("daily.log"))).isTrue();
    }

    @Test
    void updateConfig_switchesFile() throws IOException {
        loggingService = new LoggingService(fileConfig("update.log"));
        loggingService.logRequest(record("GET", "/1", 200, 0));

        loggingService.updateConfig(fileConfig("update-new.log"));
        loggingService.logRequest(record("GET", "/2", 200, 0));
        loggingService.shutdown();

        assertThat(Files.readString(tempDir.resolve("update-new.log"))).contains("GET /2");
    }

    @Test
    void parseSize_units() {
        assertThat(LoggingService.parseSize("512KB")).isEqualTo(512L * 1024);
        assertThat(LoggingService.parseSize("10mb")).isEqualTo(10L * 1024 * 1024);
        assertThat(LoggingService.parseSize("1GB")).isEqualTo(1024L * 1024 * 1024);
        assertThat(LoggingService.parseSize("100B")).isEqualTo(100L);
        assertThat(LoggingService.parseSize("42")).isEqualTo(42L);
    }

    @Test
    void parseSize_invalidFallsBackToTenMegabytes() {
        assertThat(LoggingService.parseSize(null)).isEqualTo(10L * 1024 * 1024);
        assertThat(LoggingService.parseSize("lots")).isEqualTo(10L * 1024 * 1024);
    }
}
