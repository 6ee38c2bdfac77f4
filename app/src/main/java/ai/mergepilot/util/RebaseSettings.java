package ai.mergepilot.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Effective configuration of a run. Layers, lowest first: built-in defaults, the global {@code mergepilot.properties},
 * the project's {@code .mergepilot/project.properties}. Command-line flags are applied on top by the caller.
 */
public record RebaseSettings(
        int maxAttempts,
        Duration agentTimeout,
        int resolutionContentLimit,
        int verificationContentLimit,
        @Nullable String llmBaseUrl,
        String llmModel,
        String llmApiKeyEnv) {
    private static final Logger logger = LogManager.getLogger(RebaseSettings.class);

    public static final String MAX_ATTEMPTS_KEY = "maxAttempts";
    public static final String AGENT_TIMEOUT_KEY = "agentTimeoutSeconds";
    public static final String RESOLUTION_LIMIT_KEY = "resolutionContentLimit";
    public static final String VERIFICATION_LIMIT_KEY = "verificationContentLimit";
    public static final String LLM_BASE_URL_KEY = "llm.baseUrl";
    public static final String LLM_MODEL_KEY = "llm.model";
    public static final String LLM_API_KEY_ENV_KEY = "llm.apiKeyEnv";

    public static final RebaseSettings DEFAULTS =
            new RebaseSettings(3, Duration.ofSeconds(600), 4000, 8000, null, "gpt-4o", "OPENAI_API_KEY");

    public static RebaseSettings load(Path projectRoot) {
        var props = new Properties();
        readInto(props, MergePilotConfigPaths.getGlobalPropertiesFile());
        readInto(props, MergePilotConfigPaths.getProjectPropertiesFile(projectRoot));
        return fromProperties(props);
    }

    /** Applies {@code props} over {@link #DEFAULTS}; malformed values are logged and ignored. */
    public static RebaseSettings fromProperties(Properties props) {
        var d = DEFAULTS;
        int maxAttempts = intProperty(props, MAX_ATTEMPTS_KEY, d.maxAttempts());
        if (maxAttempts < 1 || maxAttempts > 10) {
            logger.warn("Ignoring {}={}: must be between 1 and 10", MAX_ATTEMPTS_KEY, maxAttempts);
            maxAttempts = d.maxAttempts();
        }
        int timeoutSeconds = intProperty(props, AGENT_TIMEOUT_KEY, (int) d.agentTimeout().toSeconds());
        if (timeoutSeconds <= 0) {
            logger.warn("Ignoring {}={}: must be positive", AGENT_TIMEOUT_KEY, timeoutSeconds);
            timeoutSeconds = (int) d.agentTimeout().toSeconds();
        }
        var baseUrl = props.getProperty(LLM_BASE_URL_KEY);
        return new RebaseSettings(
                maxAttempts,
                Duration.ofSeconds(timeoutSeconds),
                Math.max(1, intProperty(props, RESOLUTION_LIMIT_KEY, d.resolutionContentLimit())),
                Math.max(1, intProperty(props, VERIFICATION_LIMIT_KEY, d.verificationContentLimit())),
                baseUrl == null || baseUrl.isBlank() ? null : baseUrl.trim(),
                props.getProperty(LLM_MODEL_KEY, d.llmModel()).trim(),
                props.getProperty(LLM_API_KEY_ENV_KEY, d.llmApiKeyEnv()).trim());
    }

    public RebaseSettings withMaxAttempts(int maxAttempts) {
        return new RebaseSettings(
                maxAttempts, agentTimeout, resolutionContentLimit, verificationContentLimit, llmBaseUrl, llmModel, llmApiKeyEnv);
    }

    public RebaseSettings withAgentTimeout(Duration agentTimeout) {
        return new RebaseSettings(
                maxAttempts, agentTimeout, resolutionContentLimit, verificationContentLimit, llmBaseUrl, llmModel, llmApiKeyEnv);
    }

    private static void readInto(Properties props, Path file) {
        if (!Files.isRegularFile(file)) {
            return;
        }
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
            logger.debug("Loaded settings from {}", file);
        } catch (IOException e) {
            logger.error("Error loading settings from {}: {}", file, e.getMessage());
        }
    }

    private static int intProperty(Properties props, String key, int defaultValue) {
        var value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}={}", key, value);
            return defaultValue;
        }
    }
}
