package fr.lapetina.gateway.infrastructure.config;

import fr.lapetina.gateway.domain.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Loads and validates the gateway configuration.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Loading from an arbitrary stream
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(GatewayConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The validated configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public GatewayConfig load() {
        GatewayConfig config = loadFromPath();
        config.validate();
        log.info("Configuration loaded: services={}, routes={}, strategy={}",
                config.getServices().size(), config.getRoutes().size(), config.getStrategy().getType());
        return config;
    }

    private GatewayConfig loadFromPath() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public GatewayConfig loadFromStream(InputStream inputStream) {
        GatewayConfig config = parse(inputStream, "stream");
        config.validate();
        return config;
    }

    private GatewayConfig parse(InputStream inputStream, String source) {
        try {
            GatewayConfig config = yaml.load(inputStream);
            // An empty document yields null
            return config != null ? config : new GatewayConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Creates a default configuration.
     */
    public static GatewayConfig createDefault() {
        return new GatewayConfig();
    }
}
