package de.bsommerfeld.sysml.sql.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves the OS-specific configuration directory. Paths are absolute but
 * <strong>not</strong> created, the caller decides whether it needs them.
 *
 * <p>
 * Resolution order per platform:
 * <ul>
 * <li><strong>macOS</strong>:
 * {@code ~/Library/Application Support/{appName}}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\{appName}} (fallback:
 * {@code ~/AppData/Roaming})</li>
 * <li><strong>Linux</strong>: {@code $XDG_CONFIG_HOME/{appName}} (fallback:
 * {@code ~/.config})</li>
 * </ul>
 */
public final class StoragePaths {

    public static final String APP_NAME = "sysml-v2-sql";

    private StoragePaths() {
    }

    /** The default location of {@code config.toml}. */
    public static Path defaultConfigFile() {
        return getConfigDir(APP_NAME, System.getProperty("os.name", "generic"),
                System.getProperty("user.home"), System.getenv()).resolve("config.toml");
    }

    static Path getConfigDir(String appName, String osName, String userHome, Map<String, String> env) {
        String os = osName.toLowerCase(Locale.ENGLISH);

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(userHome, "Library", "Application Support", appName);
        }
        if (os.contains("win")) {
            String appData = env.get("APPDATA");
            return appData != null
                    ? Paths.get(appData, appName)
                    : Paths.get(userHome, "AppData", "Roaming", appName);
        }
        String xdgConfig = env.get("XDG_CONFIG_HOME");
        if (xdgConfig != null && !xdgConfig.isEmpty()) {
            return Paths.get(xdgConfig, appName);
        }
        return Paths.get(userHome, ".config", appName);
    }
}
