package de.bsommerfeld.sysml.sql.core.config;

import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link SyncConfig} from a TOML file. A missing file is not an error,
 * the defaults apply; a file that exists but does not parse is.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final TomlMapper MAPPER = new TomlMapper();

    private ConfigLoader() {
    }

    public static SyncConfig load(Path path) throws IOException {
        if (path == null || !Files.exists(path)) {
            LOG.debug("No configuration at {}, using defaults", path);
            return new SyncConfig();
        }
        LOG.info("Loading configuration from: {}", path.toAbsolutePath());
        SyncConfig config = MAPPER.readValue(path.toFile(), SyncConfig.class);
        if (config.getFetch().getMaxRetries() < 0) {
            throw new IOException("fetch.max-retries must not be negative in " + path);
        }
        return config;
    }
}
