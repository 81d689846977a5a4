package com.paxkun.ezstremio.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Service;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tagged application log. Every line goes to stdout and, when a writable data root
 * exists, to {@code <dataRoot>/logs/latest.log}. On startup the previous run's file is
 * archived as {@code run-<timestamp>.log}; the five newest archives are kept.
 */
@Slf4j
@Service
public class LoggerService implements InitializingBean, DisposableBean {

    private static final String LATEST_LOG = "latest.log";
    private static final String ARCHIVE_PREFIX = "run-";
    private static final int KEPT_ARCHIVES = 5;
    private static final DateTimeFormatter ARCHIVE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");
    private static final DateTimeFormatter LINE_STAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Path dataRoot;
    private BufferedWriter writer;

    @Override
    public void afterPropertiesSet() {
        dataRoot = firstWritableRoot();
        if (dataRoot == null) {
            log.warn("⚠️ No writable data root, logging to console only.");
            return;
        }

        Path latest = dataRoot.resolve("logs").resolve(LATEST_LOG);
        try {
            createDirectories(latest.getParent());
            archive(latest);
            writer = Files.newBufferedWriter(latest, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            log.warn("⚠️ Cannot open {}, logging to console only.", latest.toAbsolutePath(), e);
            return;
        }

        write("SYSTEM", "DATA_ROOT", dataRoot.toAbsolutePath().toString());
        write("SYSTEM", "JAVA", System.getProperty("java.version") + " on " + System.getProperty("os.name"));
    }

    private Path firstWritableRoot() {
        Map<String, Path> candidates = new LinkedHashMap<>();
        candidates.put("APPDATA", resolveAppDataPath());
        candidates.put("user home", resolveUserHomePath());
        candidates.put("container", resolveContainerFallbackPath());

        for (Map.Entry<String, Path> candidate : candidates.entrySet()) {
            if (candidate.getValue() == null) {
                continue;
            }
            try {
                Path root = createDirectories(candidate.getValue());
                log.info("📁 Data root ({}): {}", candidate.getKey(), root.toAbsolutePath());
                return root;
            } catch (IOException e) {
                log.warn("⚠️ {} data root {} is not writable: {}", candidate.getKey(),
                        candidate.getValue().toAbsolutePath(), e.toString());
            }
        }
        return null;
    }

    private void archive(Path latest) throws IOException {
        if (Files.exists(latest) && Files.size(latest) > 0) {
            String name = ARCHIVE_PREFIX + LocalDateTime.now().format(ARCHIVE_STAMP) + ".log";
            Files.move(latest, latest.resolveSibling(name));
        }

        List<Path> archives;
        try (Stream<Path> files = Files.list(latest.getParent())) {
            // timestamped names sort chronologically
            archives = files
                    .filter(p -> p.getFileName().toString().startsWith(ARCHIVE_PREFIX))
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .collect(Collectors.toCollection(ArrayList::new));
        }
        for (Path stale : archives.subList(Math.min(KEPT_ARCHIVES, archives.size()), archives.size())) {
            Files.deleteIfExists(stale);
        }
    }

    protected Path createDirectories(Path path) throws IOException {
        return Files.createDirectories(path);
    }

    protected Path resolveAppDataPath() {
        String appData = System.getenv("APPDATA");
        return appData == null || appData.isBlank() ? null : Path.of(appData, "ezstremio");
    }

    protected Path resolveUserHomePath() {
        return Path.of(System.getProperty("user.home", "."), ".ezstremio");
    }

    protected Path resolveContainerFallbackPath() {
        return Path.of("/app", "data");
    }

    private synchronized void write(String level, String tag, String message) {
        String line = LocalDateTime.now().format(LINE_STAMP) + " [" + level + "] [" + tag + "] " + message + System.lineSeparator();
        System.out.print(line);
        if (writer == null) {
            return;
        }
        try {
            writer.write(line);
            writer.flush();
        } catch (IOException e) {
            log.error("❌ Log file write failed, continuing on console only", e);
            writer = null;
        }
    }

    public void info(String tag, String message) {
        write("INFO", tag, message);
    }

    public void warn(String tag, String message) {
        write("WARN", tag, message);
    }

    public void error(String tag, String message, Throwable throwable) {
        write("ERROR", tag, message + " | Exception: " + throwable.getMessage());
    }

    public void debug(String tag, String message) {
        write("DEBUG", tag, message);
    }

    public Path getDataRoot() {
        return dataRoot;
    }

    @Override
    public synchronized void destroy() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
        }
    }
}
