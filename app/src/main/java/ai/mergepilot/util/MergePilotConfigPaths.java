package ai.mergepilot.util;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Locations of MergePilot's configuration files.
 *
 * <p>Global directory:
 * - Windows: %APPDATA%/MergePilot (fallback: ~/AppData/Roaming/MergePilot)
 * - macOS: ~/Library/Application Support/MergePilot
 * - Linux: $XDG_CONFIG_HOME/MergePilot (fallback: ~/.config/MergePilot)
 *
 * <p>Per-project settings live in {@code .mergepilot/project.properties} under the working tree root.
 */
public final class MergePilotConfigPaths {
    private static final Logger logger = LogManager.getLogger(MergePilotConfigPaths.class);

    public static final String APP_DIR_NAME = "MergePilot";
    public static final String GLOBAL_PROPERTIES = "mergepilot.properties";
    public static final String PROJECT_DIR = ".mergepilot";
    public static final String PROJECT_PROPERTIES = "project.properties";

    /** System property that replaces the platform directory, mostly for tests. */
    public static final String CONFIG_DIR_PROPERTY = "mergepilot.configDir";

    private MergePilotConfigPaths() {}

    public static Path getGlobalConfigDir() {
        return getGlobalConfigDir(Optional.ofNullable(System.getProperty(CONFIG_DIR_PROPERTY)));
    }

    static Path getGlobalConfigDir(Optional<String> configDirOverride) {
        return configDirOverride
                .filter(s -> !s.isBlank())
                .flatMap(override -> {
                    try {
                        return Optional.of(Path.of(override));
                    } catch (InvalidPathException e) {
                        logger.warn("Invalid override for config dir='{}': {}", override, e.getMessage());
                        return Optional.empty();
                    }
                })
                .orElseGet(() -> {
                    var os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
                    if (os.contains("win")) {
                        var appData = System.getenv("APPDATA");
                        Path base = (appData != null && !appData.isBlank())
                                ? Path.of(appData)
                                : Path.of(System.getProperty("user.home"), "AppData", "Roaming");
                        return base.resolve(APP_DIR_NAME);
                    } else if (os.contains("mac")) {
                        return Path.of(System.getProperty("user.home"), "Library", "Application Support", APP_DIR_NAME);
                    } else {
                        var xdg = System.getenv("XDG_CONFIG_HOME");
                        Path base = (xdg != null && !xdg.isBlank())
                                ? Path.of(xdg)
                                : Path.of(System.getProperty("user.home"), ".config");
                        return base.resolve(APP_DIR_NAME);
                    }
                });
    }

    public static Path getGlobalPropertiesFile() {
        return getGlobalConfigDir().resolve(GLOBAL_PROPERTIES);
    }

    public static Path getProjectPropertiesFile(Path projectRoot) {
        return projectRoot.resolve(PROJECT_DIR).resolve(PROJECT_PROPERTIES);
    }
}
