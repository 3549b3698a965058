package com.ryuqq.semreg.application.scanner.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * YAML (or JSON) file backed {@link VerbConfigSource}.
 *
 * <p>JSON is a subset of YAML, so either format is accepted. Keys are snake_case.
 * Unknown keys are ignored so richer configuration files can be scanned as-is.</p>
 *
 * @author Semantic Registry Team
 * @since 1.0.0
 */
public final class YamlVerbConfigSource implements VerbConfigSource {

    private static final Logger log = LoggerFactory.getLogger(YamlVerbConfigSource.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path path;

    /**
     * Constructor.
     *
     * @param path configuration file
     * @throws IllegalArgumentException if path is null
     */
    public YamlVerbConfigSource(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        this.path = path;
    }

    @Override
    public VerbsConfig load() {
        if (!Files.isRegularFile(path)) {
            throw new VerbConfigException("Verb configuration not found: " + path);
        }
        try {
            VerbsConfig config = YAML.readValue(path.toFile(), VerbsConfig.class);
            if (config == null) {
                throw new VerbConfigException("Verb configuration is empty: " + path);
            }
            log.debug("Loaded {} verbs in {} domains from {}", config.verbCount(), config.domains().size(), path);
            return config;
        } catch (JsonProcessingException e) {
            throw new VerbConfigException("Failed to parse verb configuration " + path + ": "
                + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new VerbConfigException("Failed to read verb configuration " + path, e);
        }
    }

    /**
     * Source file.
     *
     * @return path
     */
    public Path path() {
        return path;
    }
}
