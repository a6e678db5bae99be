package de.bsommerfeld.crashscope.core.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link CrashScopeConfig} from a TOML file, writing the defaults first
 * when the file does not exist yet. Unknown keys are ignored so that older
 * builds can read files written by newer ones.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    private static final String HEADER = "# CrashScope - Global Configuration\n";

    private static final TomlMapper MAPPER = TomlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {
    }

    public static CrashScopeConfig load(Path file) throws IOException {
        if (!Files.exists(file) || Files.size(file) == 0) {
            CrashScopeConfig defaults = new CrashScopeConfig();
            save(defaults, file);
            LOG.info("Wrote default configuration to {}", file);
            return defaults;
        }
        CrashScopeConfig config = MAPPER.readValue(file.toFile(), CrashScopeConfig.class);
        sanitize(config.getInstaller());
        return config;
    }

    /**
     * Timeouts must be positive; a zero deadline would fail every install
     * with a timeout. Offending values fall back to their defaults.
     */
    static void sanitize(InstallerConfig installer) {
        if (installer.getCommandTimeoutSeconds() <= 0) {
            LOG.warn("installer.command-timeout-seconds must be positive, was {}; using {}",
                    installer.getCommandTimeoutSeconds(), InstallerConfig.DEFAULT_COMMAND_TIMEOUT_SECONDS);
            installer.setCommandTimeoutSeconds(InstallerConfig.DEFAULT_COMMAND_TIMEOUT_SECONDS);
        }
        if (installer.getVerifyTimeoutSeconds() <= 0) {
            LOG.warn("installer.verify-timeout-seconds must be positive, was {}; using {}",
                    installer.getVerifyTimeoutSeconds(), InstallerConfig.DEFAULT_VERIFY_TIMEOUT_SECONDS);
            installer.setVerifyTimeoutSeconds(InstallerConfig.DEFAULT_VERIFY_TIMEOUT_SECONDS);
        }
    }

    public static void save(CrashScopeConfig config, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, HEADER + MAPPER.writeValueAsString(config));
    }
}
