package de.bsommerfeld.sysml.sql.core.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StoragePathsTest {

    @Test
    void getConfigDir_shouldUseXdgConfigHomeOnLinux() {
        Path dir = StoragePaths.getConfigDir("app", "Linux", "/home/u", Map.of("XDG_CONFIG_HOME", "/xdg"));
        assertEquals(Paths.get("/xdg", "app"), dir);
    }

    @Test
    void getConfigDir_shouldFallBackToDotConfig() {
        Path dir = StoragePaths.getConfigDir("app", "Linux", "/home/u", Map.of());
        assertEquals(Paths.get("/home/u", ".config", "app"), dir);
    }

    @Test
    void getConfigDir_shouldUseApplicationSupportOnMac() {
        Path dir = StoragePaths.getConfigDir("app", "Mac OS X", "/Users/u", Map.of());
        assertTrue(dir.toString().contains("Application Support"));
    }

    @Test
    void getConfigDir_shouldUseAppDataOnWindows() {
        Path dir = StoragePaths.getConfigDir("app", "Windows 11", "C:/Users/u", Map.of("APPDATA", "C:/Roaming"));
        assertEquals(Paths.get("C:/Roaming", "app"), dir);
    }

    @Test
    void defaultConfigFile_shouldBeNamedConfigToml() {
        assertEquals("config.toml", StoragePaths.defaultConfigFile().getFileName().toString());
    }
}
