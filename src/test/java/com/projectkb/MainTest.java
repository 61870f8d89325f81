package com.projectkb;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.projectkb.runtime.AppConfig;
import com.projectkb.runtime.ServiceFactory;
import com.projectkb.store.Document;
import com.projectkb.store.DocumentStatus;

class MainTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRequireJobIdInStatusMode() throws IOException {
        Path configPath = writeTestConfig();

        int exitCode = Main.commandLine(new Main()).execute("--mode", "status", "--config", configPath.toString());

        assertEquals(2, exitCode);
    }

    @Test
    void shouldAcceptDashedModeNames() throws IOException {
        Path configPath = writeTestConfig();

        int exitCode = Main.commandLine(new Main()).execute(
                "--mode", "delete-document",
                "--project", "handbook",
                "--config", configPath.toString());

        assertEquals(2, exitCode);
    }

    @Test
    void shouldIngestAndSearchFromCommandLine() throws IOException {
        Path configPath = writeTestConfig();
        Path file = tempDir.resolve("onboarding.txt");
        Files.writeString(file, "New hires receive a laptop and badge on their first day.");

        int ingestExit = Main.commandLine(new Main()).execute(
                "--mode", "ingest",
                "--project", "handbook",
                "--file", file.toString(),
                "--wait-seconds", "30",
                "--config", configPath.toString());
        int searchExit = Main.commandLine(new Main()).execute(
                "--mode", "search",
                "--project", "handbook",
                "--query", "laptop on first day",
                "--top-k", "5",
                "--top-m", "1",
                "--config", configPath.toString());

        assertEquals(0, ingestExit);
        assertEquals(0, searchExit);
        try (KnowledgeBaseService service = ServiceFactory.create(Main.loadConfig(configPath), Map.of())) {
            List<Document> documents = service.listDocuments("handbook");
            assertEquals(1, documents.size());
            assertEquals("onboarding.txt", documents.get(0).filename());
            assertEquals(DocumentStatus.READY, documents.get(0).status());
        }
    }

    @Test
    void shouldReportUnknownJobAsExecutionFailure() throws IOException {
        Path configPath = writeTestConfig();

        int exitCode = Main.commandLine(new Main()).execute(
                "--mode", "status",
                "--job-id", "does-not-exist",
                "--config", configPath.toString());

        assertEquals(1, exitCode);
    }

    @Test
    void shouldLoadYamlConfig() throws IOException {
        AppConfig config = Main.loadConfig(writeTestConfig());

        assertEquals(tempDir.resolve("data").toString(), config.getStorage().getDataDir());
        assertEquals(300, config.getChunking().getSize());
        assertEquals(32, config.getEmbedding().getDimension());
        assertEquals(List.of("handbook"), config.getProjects().getAllowed());
        assertEquals(20, config.getRetrieval().getCandidateK());
        assertEquals(4, config.getRetrieval().getFinalM());
        assertEquals(5000, config.getRetrieval().getMaxContextChars());
        assertEquals(2, config.getIngestion().getWorkersPerJob());
    }

    private Path writeTestConfig() throws IOException {
        Path configPath = tempDir.resolve("test-config.yml");
        Files.writeString(configPath, """
                storage:
                  dataDir: "%s"
                projects:
                  allowed:
                    - handbook
                chunking:
                  size: 300
                  overlap: 30
                embedding:
                  provider: hashing
                  dimension: 32
                rerank:
                  enabled: true
                  scorer: lexical
                retrieval:
                  candidateK: 20
                  finalM: 4
                  maxContextChars: 5000
                ingestion:
                  workersPerJob: 2
                """.formatted(tempDir.resolve("data").toString().replace("\\", "\\\\")));
        return configPath;
    }
}
