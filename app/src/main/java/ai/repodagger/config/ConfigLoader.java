package ai.repodagger.config;

import ai.repodagger.DaggerException.ConfigException;
import ai.repodagger.hashing.ContentHashes;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Reads the YAML configuration, rejecting unknown keys, and hashes its raw bytes. */
public final class ConfigLoader {
    private static final Logger logger = LogManager.getLogger(ConfigLoader.class);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);

    private ConfigLoader() {}

    /**
     * A loaded config together with the values derived from where it lives.
     *
     * @param config the decoded configuration
     * @param baseDir absolute, normalized base directory (config directory joined with {@code base_dir})
     * @param configHash SHA-256 of the raw config file bytes
     */
    public record LoadedConfig(DaggerConfig config, Path baseDir, byte[] configHash) {
        public LoadedConfig {
            configHash = configHash.clone();
        }

        @Override
        public byte[] configHash() {
            return configHash.clone();
        }

        public LoadedConfig withConfig(DaggerConfig newConfig) {
            return new LoadedConfig(newConfig, baseDir, configHash);
        }
    }

    public static LoadedConfig load(Path configPath) throws ConfigException {
        byte[] data;
        try {
            data = Files.readAllBytes(configPath);
        } catch (IOException e) {
            throw new ConfigException("failed to read config file '%s': %s".formatted(configPath, e), e);
        }

        var config = parse(data);
        var configDir = configPath.toAbsolutePath().getParent();
        var baseDir = configDir.resolve(config.baseDir()).normalize();
        return new LoadedConfig(config, baseDir, ContentHashes.sha256(data));
    }

    /** Decodes config bytes; exposed separately so the schema can be checked without a file. */
    public static DaggerConfig parse(byte[] data) throws ConfigException {
        DaggerConfig config;
        try {
            config = YAML_MAPPER.readValue(data, DaggerConfig.class);
        } catch (IOException e) {
            throw new ConfigException("failed to decode config file: " + e.getMessage(), e);
        }
        if (config == null) {
            // an empty document decodes to null
            config = new DaggerConfig(null, null, null, null, null, null);
        }

        for (var entry : config.pathRules().entrySet()) {
            if (entry.getValue() == null) {
                throw new ConfigException("path_rule '%s' has no body".formatted(entry.getKey()));
            }
            if (!entry.getValue().exclude().isEmpty()) {
                logger.warn(
                        "path_rule '{}' declares 'exclude', which only applies inside regex_rules; ignoring it",
                        entry.getKey());
            }
            for (var regexEntry : entry.getValue().regexRules().entrySet()) {
                if (regexEntry.getValue() == null) {
                    throw new ConfigException("regex rule '%s' in path_rule '%s' has no body"
                            .formatted(regexEntry.getKey(), entry.getKey()));
                }
            }
        }
        return config;
    }

    /** Renders the config for the verbose dump. */
    public static String describe(DaggerConfig config) {
        try {
            return YAML_MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            return config.toString();
        }
    }
}
