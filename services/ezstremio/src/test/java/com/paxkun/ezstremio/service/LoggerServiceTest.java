package com.paxkun.ezstremio.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class LoggerServiceTest {

    @Test
    void initializesWithContainerFallbackWhenAccessDenied(CapturedOutput output) throws IOException {
        Path containerFallback = Files.createTempDirectory("logger-service");

        LoggerService service = new LoggerService() {
            private int attempts = 0;

            @Override
            protected Path resolveAppDataPath() {
                return Path.of("/denied/appdata");
            }

            @Override
            protected Path resolveUserHomePath() {
                return Path.of("/denied/userhome");
            }

            @Override
            protected Path resolveContainerFallbackPath() {
                return containerFallback;
            }

            @Override
            protected Path createDirectories(Path path) throws IOException {
                attempts++;
                if (attempts <= 2) {
                    throw new AccessDeniedException(path.toString());
                }
                return Files.createDirectories(path);
            }
        };

        service.afterPropertiesSet();
        service.destroy();

        assertThat(service.getDataRoot()).isEqualTo(containerFallback);
        assertThat(output).contains("⚠️ APPDATA data root").contains("is not writable");
    }

    @Test
    void writesTaggedLinesToLatestLog(CapturedOutput output) throws IOException {
        Path tempRoot = Files.createTempDirectory("logger-service-env");

        LoggerService service = new LoggerService() {
            @Override
            protected Path resolveAppDataPath() {
                return tempRoot;
            }
        };

        service.afterPropertiesSet();
        service.warn("SEARCH", "⚠️ No results for [wicked]: timeout");
        service.destroy();

        assertThat(output).contains("[SYSTEM] [DATA_ROOT] " + tempRoot.toAbsolutePath());
        assertThat(Files.readString(tempRoot.resolve("logs").resolve("latest.log")))
                .contains("[WARN] [SEARCH] ⚠️ No results for [wicked]: timeout");
    }

    @Test
    void rotatesPreviousLatestLog() throws IOException {
        Path tempRoot = Files.createTempDirectory("logger-service-rotate");
        Path logs = Files.createDirectories(tempRoot.resolve("logs"));
        Files.writeString(logs.resolve("latest.log"), "previous run\n");

        LoggerService service = new LoggerService() {
            @Override
            protected Path resolveAppDataPath() {
                return tempRoot;
            }
        };

        service.afterPropertiesSet();
        service.destroy();

        try (Stream<Path> files = Files.list(logs)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .contains("latest.log")
                    .anyMatch(name -> !name.equals("latest.log") && name.endsWith(".log"));
        }
        assertThat(Files.readString(logs.resolve("latest.log"))).doesNotContain("previous run");
    }

    @Test
    void keepsOnlyTheNewestArchives() throws IOException {
        Path tempRoot = Files.createTempDirectory("logger-service-prune");
        Path logs = Files.createDirectories(tempRoot.resolve("logs"));
        for (int day = 1; day <= 7; day++) {
            Files.writeString(logs.resolve("run-2020010" + day + "-000000.log"), "old\n");
        }
        Files.writeString(logs.resolve("latest.log"), "previous run\n");

        LoggerService service = new LoggerService() {
            @Override
            protected Path resolveAppDataPath() {
                return tempRoot;
            }
        };

        service.afterPropertiesSet();
        service.destroy();

        try (Stream<Path> files = Files.list(logs)) {
            assertThat(files.map(p -> p.getFileName().toString()).filter(name -> name.startsWith("run-")))
                    .hasSize(5)
                    .doesNotContain("run-20200101-000000.log", "run-20200102-000000.log", "run-20200103-000000.log")
                    .contains("run-20200107-000000.log");
        }
    }
}
