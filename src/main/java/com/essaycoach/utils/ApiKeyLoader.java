package com.essaycoach.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Finds the API key for the judgment and embedding models.
 * Priority: 1. environment variable, 2. {@code .env} file, 3. {@code config.properties}.
 */
public class ApiKeyLoader {
    private static final Logger logger = LoggerFactory.getLogger(ApiKeyLoader.class);

    public static final String ENV_VARIABLE = "OPENAI_API_KEY";
    public static final String PROPERTY_NAME = "openai.api.key";
    private static final String PLACEHOLDER = "your-openai-api-key-here";

    private final Path baseDirectory;
    private final Map<String, String> environment;

    public ApiKeyLoader() {
        this(Paths.get("."), System.getenv());
    }

    public ApiKeyLoader(Path baseDirectory, Map<String, String> environment) {
        this.baseDirectory = baseDirectory;
        this.environment = environment;
    }

    /**
     * @return the key, or empty when none is configured and the models must run offline
     */
    public Optional<String> loadOpenAIKey() {
        String apiKey = environment.get(ENV_VARIABLE);
        if (isUsable(apiKey)) {
            logger.info("Using OpenAI API key from environment variable");
            return Optional.of(apiKey.trim());
        }

        apiKey = loadFromDotEnv(ENV_VARIABLE);
        if (isUsable(apiKey)) {
            logger.info("Using OpenAI API key from .env file");
            return Optional.of(apiKey.trim());
        }

        apiKey = loadConfigFile().getProperty(PROPERTY_NAME);
        if (isUsable(apiKey)) {
            logger.info("Using OpenAI API key from config file");
            return Optional.of(apiKey.trim());
        }

        logger.warn("No valid OpenAI API key found, grading will run without the judgment model");
        return Optional.empty();
    }

    private static boolean isUsable(String apiKey) {
        return apiKey != null && !apiKey.isBlank() && !apiKey.trim().equals(PLACEHOLDER);
    }

    /**
     * Load config.properties from the base directory, then the classpath
     */
    private Properties loadConfigFile() {
        Properties config = new Properties();
        Path file = baseDirectory.resolve("config.properties");
        if (Files.exists(file)) {
            try (InputStream input = Files.newInputStream(file)) {
                config.load(input);
                return config;
            } catch (IOException e) {
                logger.warn("Could not read {}: {}", file, e.getMessage());
            }
        }
        try (InputStream input = ApiKeyLoader.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (input != null) {
                config.load(input);
            }
        } catch (IOException e) {
            logger.warn("Could not read config.properties from classpath: {}", e.getMessage());
        }
        return config;
    }

    /**
     * Read one key from a {@code .env} file in the base directory (simple parser).
     */
    private String loadFromDotEnv(String keyName) {
        Path envPath = baseDirectory.resolve(".env");
        if (!Files.exists(envPath)) {
            return null;
        }
        try {
            for (String rawLine : Files.readAllLines(envPath)) {
                String line = rawLine.trim();
                if (line.isEmpty() || line.startsWith("#")) continue;
                if (line.startsWith("export ")) line = line.substring(7).trim();
                int eq = line.indexOf('=');
                if (eq <= 0) continue;
                String k = line.substring(0, eq).trim();
                String v = line.substring(eq + 1).trim();
                if (v.length() >= 2 && ((v.startsWith("\"") && v.endsWith("\"")) || (v.startsWith("'") && v.endsWith("'")))) {
                    v = v.substring(1, v.length() - 1);
                }
                if (k.equals(keyName)) {
                    return v;
                }
            }
        } catch (IOException e) {
            logger.warn("Failed to read .env file: {}", e.getMessage());
        }
        return null;
    }
}
