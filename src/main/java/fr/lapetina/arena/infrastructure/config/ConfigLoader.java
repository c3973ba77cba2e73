package fr.lapetina.arena.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;

/**
 * Loads the arena configuration from YAML.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Resolving the upstream API key from the environment
 * - Validating the model pool before anything is wired
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;
    private final Function<String, String> environment;

    public ConfigLoader(String configPath) {
        this(configPath, System::getenv);
    }

    public ConfigLoader(String configPath, Function<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = environment;
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(ArenaConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded and validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public ArenaConfig load() {
        return finish(loadFromPath());
    }

    /**
     * Loads configuration from an input stream.
     */
    public ArenaConfig loadFromStream(InputStream inputStream) {
        return finish(yaml.load(inputStream));
    }

    private ArenaConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return yaml.load(is);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private ArenaConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return yaml.load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private ArenaConfig finish(ArenaConfig config) {
        if (config == null) {
            throw new ConfigurationException("Configuration is empty: " + configPath);
        }
        resolveApiKey(config.getApi());
        validate(config);
        log.info("Configuration loaded: models={}, voteStore={}, cooldownMs={}",
                config.getModels().size(), config.getVoteStore().getType(),
                config.getRateLimit().getCooldownMs());
        return config;
    }

    private void resolveApiKey(ArenaConfig.ApiConfig api) {
        if (api.getApiKey() != null && !api.getApiKey().isBlank()) {
            return;
        }
        String envName = api.getApiKeyEnv();
        String fromEnv = envName == null ? null : environment.apply(envName);
        if (fromEnv == null || fromEnv.isBlank()) {
            throw new ConfigurationException(
                    "No API key configured: set api.apiKey or the " + envName + " environment variable");
        }
        api.setApiKey(fromEnv.trim());
    }

    private void validate(ArenaConfig config) {
        if (config.getModels() == null || config.getModels().size() < 2) {
            throw new ConfigurationException("At least two models must be configured");
        }
        Set<String> ids = new HashSet<>();
        for (ArenaConfig.ModelConfig model : config.getModels()) {
            if (model.getId() == null || model.getId().isBlank()) {
                throw new ConfigurationException("Model id must not be blank");
            }
            if (!ids.add(model.getId())) {
                throw new ConfigurationException("Duplicate model id: " + model.getId());
            }
        }
        if (config.getRateLimit().getCooldownMs() <= 0) {
            throw new ConfigurationException("rateLimit.cooldownMs must be positive");
        }
        if (config.getApi().getRequestTimeoutMs() <= 0 || config.getApi().getConnectTimeoutMs() <= 0) {
            throw new ConfigurationException("API timeouts must be positive");
        }
        if (config.getRetry().getMaxRetries() < 0) {
            throw new ConfigurationException("retry.maxRetries must not be negative");
        }
        if (config.getValidation().getMaxPromptLength() <= 0) {
            throw new ConfigurationException("validation.maxPromptLength must be positive");
        }
        int ringSize = config.getVoteStore().getRingBufferSize();
        if (ringSize <= 0 || Integer.bitCount(ringSize) != 1) {
            throw new ConfigurationException("voteStore.ringBufferSize must be a power of two");
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
