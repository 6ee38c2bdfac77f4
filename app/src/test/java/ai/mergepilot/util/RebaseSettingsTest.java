package ai.mergepilot.util;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RebaseSettingsTest {

    @TempDir
    Path tempDir;

    private String originalConfigDir;

    @BeforeEach
    void pointGlobalConfigAtTempDir() {
        originalConfigDir = System.getProperty(MergePilotConfigPaths.CONFIG_DIR_PROPERTY);
        System.setProperty(MergePilotConfigPaths.CONFIG_DIR_PROPERTY, tempDir.resolve("global").toString());
    }

    @AfterEach
    void restore() {
        if (originalConfigDir == null) {
            System.clearProperty(MergePilotConfigPaths.CONFIG_DIR_PROPERTY);
        } else {
            System.setProperty(MergePilotConfigPaths.CONFIG_DIR_PROPERTY, originalConfigDir);
        }
    }

    @Test
    void testDefaultsWhenNoFilesExist() {
        assertEquals(RebaseSettings.DEFAULTS, RebaseSettings.load(tempDir.resolve("project")));
    }

    @Test
    void testProjectOverridesGlobal() throws Exception {
        var global = tempDir.resolve("global").resolve(MergePilotConfigPaths.GLOBAL_PROPERTIES);
        Files.createDirectories(global.getParent());
        Files.writeString(global, "maxAttempts=5\nllm.model=global-model\nagentTimeoutSeconds=120\n");

        var project = tempDir.resolve("project");
        var projectFile = MergePilotConfigPaths.getProjectPropertiesFile(project);
        Files.createDirectories(projectFile.getParent());
        Files.writeString(projectFile, "llm.model=project-model\nllm.baseUrl= http://localhost:8080/v1 \n");

        var settings = RebaseSettings.load(project);

        assertEquals(5, settings.maxAttempts());
        assertEquals(Duration.ofSeconds(120), settings.agentTimeout());
        assertEquals("project-model", settings.llmModel());
        assertEquals("http://localhost:8080/v1", settings.llmBaseUrl());
        assertEquals("OPENAI_API_KEY", settings.llmApiKeyEnv());
    }

    @Test
    void testMalformedValuesFallBackToDefaults() {
        var props = new Properties();
        props.setProperty(RebaseSettings.MAX_ATTEMPTS_KEY, "eleven");
        props.setProperty(RebaseSettings.AGENT_TIMEOUT_KEY, "-5");
        props.setProperty(RebaseSettings.RESOLUTION_LIMIT_KEY, "0");
        props.setProperty(RebaseSettings.LLM_BASE_URL_KEY, "  ");

        var settings = RebaseSettings.fromProperties(props);

        assertEquals(3, settings.maxAttempts());
        assertEquals(Duration.ofSeconds(600), settings.agentTimeout());
        assertEquals(1, settings.resolutionContentLimit());
        assertEquals(8000, settings.verificationContentLimit());
        assertNull(settings.llmBaseUrl());
    }

    @Test
    void testOutOfRangeMaxAttemptsIgnored() {
        var props = new Properties();
        props.setProperty(RebaseSettings.MAX_ATTEMPTS_KEY, "25");
        assertEquals(3, RebaseSettings.fromProperties(props).maxAttempts());
    }

    @Test
    void testWithers() {
        var settings = RebaseSettings.DEFAULTS.withMaxAttempts(7).withAgentTimeout(Duration.ofSeconds(30));
        assertEquals(7, settings.maxAttempts());
        assertEquals(Duration.ofSeconds(30), settings.agentTimeout());
        assertEquals(RebaseSettings.DEFAULTS.llmModel(), settings.llmModel());
    }
}
