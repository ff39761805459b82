package com.kawari.proxy.core.services;

import com.kawari.proxy.config.LoggingConfig;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Access log for dispatched requests. Lines are formatted with Apache-style tokens,
 * emitted through SLF4J and optionally appended to a file by a background writer
 * with daily or size-based rotation.
 */
public class LoggingService {

    private static final Logger log = LoggerFactory.getLogger(LoggingService.class);
    private static final Logger accessLog = LoggerFactory.getLogger("kawari.access");
    private static final String LOG_QUEUE_FULL_MSG = "Access log queue is full, dropping line: {}";

    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd/MMM/yyyy:HH:mm:ss Z",
            Locale.ENGLISH);
    private static final DateTimeFormatter DAILY_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter SIZE_KEY = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

    private final AtomicReference<LoggingConfig> config;

    /** Formatted timestamp, refreshed at most once per second. */
    private volatile String cachedTimestamp = "";
    private volatile long cachedTimestampSec = 0;

    private final BlockingQueue<String> logQueue = new LinkedBlockingQueue<>(10000);
    private final Object lock = new Object();
    private final Thread writerThread;
    private volatile boolean running = true;
    private String currentRotationKey;
    private long currentSizeBytes;
    private BufferedWriter currentWriter;
    private String currentOpenPath;

    /**
     * One completed request as seen by the access log.
     *
     * @param remoteHost client address.
     * @param method     request method.
     * @param target     request target as received.
     * @param status     status returned to the client.
     * @param bytes      response body bytes sent.
     * @param identity   identity presented upstream, or {@code null}.
     * @param backend    backend used, or {@code null} when direct or not dispatched.
     * @param attempts   attempts made, {@code 0} when not dispatched.
     */
    public record AccessRecord(String remoteHost, String method, String target, int status, long bytes,
            String identity, String backend, int attempts) {
    }

    /**
     * @param config access log settings.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public LoggingService(LoggingConfig config) {
        this.config = new AtomicReference<>(config);
        this.writerThread = new Thread(this::drainQueue, "kawari-access-writer");
        this.writerThread.setDaemon(true);
        this.writerThread.start();
    }

    private void drainQueue() {
        while (running || !logQueue.isEmpty()) {
            try {
                String line = logQueue.poll(100, TimeUnit.MILLISECONDS);
                if (line != null) {
                    writeToFile(line);
                } else {
                    synchronized (lock) {
                        closeCurrentWriter();
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (IOException | RuntimeException e) {
                log.error("Error in access log writer thread", e);
                synchronized (lock) {
                    closeCurrentWriter();
                }
            }
        }
        synchronized (lock) {
            closeCurrentWriter();
        }
    }

    private void writeToFile(String line) throws IOException {
        LoggingConfig cfg = config.get();
        if (!cfg.isFileEnabled()) {
            return;
        }
        synchronized (lock) {
            Path dir = Paths.get(cfg.getFilePath());
            if (!Files.exists(dir)) {
                Files.createDirectories(dir);
            }
            checkRotation(cfg);

            Path logPath = dir.resolve(cfg.getFileName());
            String pathStr = logPath.toString();
            if (currentWriter == null || !pathStr.equals(currentOpenPath)) {
                closeCurrentWriter();
                currentWriter = new BufferedWriter(new FileWriter(logPath.toFile(), StandardCharsets.UTF_8, true));
                currentOpenPath = pathStr;
            }

            appendLine(currentWriter, line);
            int batch = 0;
            String next;
            while (batch++ < 100 && (next = logQueue.poll()) != null) {
                appendLine(currentWriter, next);
            }
            currentWriter.flush();
        }
    }

    private void appendLine(BufferedWriter bw, String line) throws IOException {
        bw.write(line);
        bw.newLine();
        currentSizeBytes += line.getBytes(StandardCharsets.UTF_8).length + System.lineSeparator().length();
    }

    private void closeCurrentWriter() {
        if (currentWriter != null) {
            try {
                currentWriter.close();
            } catch (IOException e) {
                log.error("Failed to close access log writer", e);
            }
            currentWriter = null;
            currentOpenPath = null;
        }
    }

    private void checkRotation(LoggingConfig cfg) throws IOException {
        String rotation = cfg.getRotation() == null ? "DAILY" : cfg.getRotation().toUpperCase(Locale.ROOT);
        LocalDateTime now = LocalDateTime.now();
        String key;
        boolean due;
        if ("SIZE".equals(rotation)) {
            key = now.format(SIZE_KEY);
            due = isSizeRotationDue(cfg);
        } else {
            key = now.format(DAILY_KEY);
            due = currentRotationKey != null && !currentRotationKey.equals(key);
        }

        if (due) {
            closeCurrentWriter();
            rotate(cfg, currentRotationKey != null ? currentRotationKey : key);
            currentRotationKey = key;
            currentSizeBytes = 0;
        } else if (currentRotationKey == null) {
            currentRotationKey = key;
        }
    }

    private boolean isSizeRotationDue(LoggingConfig cfg) throws IOException {
        if (currentSizeBytes == 0) {
            Path logPath = Paths.get(cfg.getFilePath(), cfg.getFileName());
            if (Files.exists(logPath)) {
                currentSizeBytes = Files.size(logPath);
            }
        }
        return currentSizeBytes >= parseSize(cfg.getMaxSize());
    }

    private void rotate(LoggingConfig cfg, String suffix) throws IOException {
        Path currentLog = Paths.get(cfg.getFilePath(), cfg.getFileName());
        if (!Files.exists(currentLog)) {
            return;
        }
        String rotatedName = cfg.getFileName() + "." + suffix;
        Path rotated = Paths.get(cfg.getFilePath(), rotatedName);
        int i = 1;
        while (Files.exists(rotated)) {
            rotated = Paths.get(cfg.getFilePath(), rotatedName + "." + i++);
        }
        Files.move(currentLog, rotated);
        log.debug("Rotated access log to {}", rotated);
        cleanupOldLogs(cfg);
    }

    private void cleanupOldLogs(LoggingConfig cfg) {
        File dir = new File(cfg.getFilePath());
        File[] files = dir.listFiles((d, name) -> name.startsWith(cfg.getFileName() + "."));
        if (files == null || files.length <= cfg.getMaxHistory()) {
            return;
        }
        Arrays.sort(files, Comparator.comparingLong(File::lastModified));
        for (int i = 0; i < files.length - cfg.getMaxHistory(); i++) {
            try {
                Files.deleteIfExists(files[i].toPath());
            } catch (IOException e) {
                log.warn("Failed to delete old access log {}: {}", files[i].getName(), e.getMessage());
            }
        }
    }

    /**
     * Parses sizes such as {@code 10MB}, {@code 512KB} or {@code 100B}.
     *
     * @param size size string.
     * @return bytes, 10 MB when unparseable.
     */
    static long parseSize(String size) {
        if (size == null) {
            return 10L * 1024 * 1024;
        }
        String s = size.toUpperCase(Locale.ROOT).trim();
        long multiplier = 1;
        if (s.endsWith("KB")) {
            multiplier = 1024L;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("MB")) {
            multiplier = 1024L * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("GB")) {
            multiplier = 1024L * 1024 * 1024;
            s = s.substring(0, s.length() - 2);
        } else if (s.endsWith("B")) {
            s = s.substring(0, s.length() - 1);
        }
        try {
            return Long.parseLong(s.trim()) * multiplier;
        } catch (NumberFormatException e) {
            return 10L * 1024 * 1024;
        }
    }

    /**
     * Swaps the configuration, e.g. after a reload. Rotation state restarts.
     *
     * @param newConfig new settings.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void updateConfig(LoggingConfig newConfig) {
        synchronized (lock) {
            config.set(newConfig);
            currentRotationKey = null;
            currentSizeBytes = 0;
            closeCurrentWriter();
        }
    }

    /**
     * Logs one request.
     *
     * @param entry what happened.
     */
    public void logRequest(AccessRecord entry) {
        LoggingConfig cfg = config.get();
        String line = format(cfg.getFormat(), entry);
        accessLog.info(line);
        if (cfg.isFileEnabled() && !logQueue.offer(line)) {
            log.debug(LOG_QUEUE_FULL_MSG, line);
        }
    }

    /**
     * Formats a line. Tokens: %h %l %u %t %r %>s %b %m %q, plus %i (identity),
     * %x (backend) and %a (attempts). Unknown tokens are kept literally.
     */
    String format(String pattern, AccessRecord entry) {
        StringBuilder sb = new StringBuilder(pattern.length() + 128);
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c != '%' || i + 1 >= pattern.length()) {
                sb.append(c);
                i++;
                continue;
            }
            char token = pattern.charAt(i + 1);
            int consumed = 2;
            switch (token) {
                case 'h' -> sb.append(orDash(entry.remoteHost()));
                case 'l', 'u' -> sb.append('-');
                case 't' -> sb.append('[').append(timestamp()).append(']');
                case 'r' -> sb.append(entry.method()).append(' ').append(entry.target()).append(" HTTP/1.1");
                case 'm' -> sb.append(entry.method());
                case 'q' -> sb.append(query(entry.target()));
                case 'b' -> sb.append(entry.bytes() > 0 ? String.valueOf(entry.bytes()) : "-");
                case 'i' -> sb.append(orDash(entry.identity()));
                case 'x' -> sb.append(entry.backend() != null ? entry.backend() : "direct");
                case 'a' -> sb.append(entry.attempts());
                case '>' -> {
                    if (i + 2 < pattern.length() && pattern.charAt(i + 2) == 's') {
                        sb.append(entry.status());
                        consumed = 3;
                    } else {
                        sb.append('%');
                        consumed = 1;
                    }
                }
                default -> {
                    sb.append('%');
                    consumed = 1;
                }
            }
            i += consumed;
        }
        return sb.toString();
    }

    private static String orDash(String value) {
        return value == null || value.isEmpty() ? "-" : value;
    }

    private static String query(String target) {
        if (target == null) {
            return "";
        }
        int idx = target.indexOf('?');
        return idx == -1 ? "" : target.substring(idx);
    }

    private String timestamp() {
        long nowSec = Instant.now().getEpochSecond();
        if (nowSec != cachedTimestampSec) {
            cachedTimestamp = ZonedDateTime.now().format(DATE_FORMATTER);
            cachedTimestampSec = nowSec;
        }
        return cachedTimestamp;
    }

    /**
     * Flushes pending lines and stops the writer thread.
     */
    public void shutdown() {
        running = false;
        try {
            writerThread.join(5000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
