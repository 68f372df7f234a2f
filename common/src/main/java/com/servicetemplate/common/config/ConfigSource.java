package com.servicetemplate.common.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layered configuration lookup.
 * A dotted key such as {@code service.name} is resolved from, in order: the environment variable
 * {@code SERVICE_NAME}, the system property {@code service.name}, the {@code .env} file
 * ({@code SERVICE_NAME=...}), the classpath {@code application.properties}, then the default.
 */
public class ConfigSource {

    private static final Logger logger = LoggerFactory.getLogger(ConfigSource.class);

    public static final String DEFAULT_RESOURCE = "application.properties";
    public static final Path DEFAULT_DOTENV = Path.of(".env");

    private final Map<String, String> environment;
    private final Properties systemProperties;
    private final Map<String, String> dotEnv;
    private final Properties properties;

    public ConfigSource(Map<String, String> environment, Properties systemProperties,
                        Map<String, String> dotEnv, Properties properties) {
        this.environment = environment == null ? Map.of() : environment;
        this.systemProperties = systemProperties == null ? new Properties() : systemProperties;
        this.dotEnv = dotEnv == null ? Map.of() : dotEnv;
        this.properties = properties == null ? new Properties() : properties;
    }

    /**
     * Reads the process environment, system properties, {@code ./.env} and the classpath
     * {@code application.properties}.
     */
    public static ConfigSource load() {
        return load(DEFAULT_RESOURCE, DEFAULT_DOTENV);
    }

    public static ConfigSource load(String resource, Path dotEnvFile) {
        return new ConfigSource(System.getenv(), System.getProperties(),
                readDotEnv(dotEnvFile), readResource(resource));
    }

    private static Properties readResource(String resource) {
        Properties props = new Properties();
        try (InputStream input = ConfigSource.class.getClassLoader().getResourceAsStream(resource)) {
            if (input != null) {
                props.load(input);
            }
        } catch (IOException e) {
            logger.warn("[Config] Could not load {}: {}", resource, e.getMessage());
        }
        return props;
    }

    static Map<String, String> readDotEnv(Path file) {
        Map<String, String> values = new HashMap<>();
        if (file == null || !Files.isRegularFile(file)) {
            return values;
        }
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
                if (trimmed.startsWith("export ")) {
                    trimmed = trimmed.substring("export ".length()).trim();
                }
                int eq = trimmed.indexOf('=');
                if (eq <= 0) continue;
                String key = trimmed.substring(0, eq).trim();
                String value = unquote(trimmed.substring(eq + 1).trim());
                values.put(key, value);
            }
        } catch (IOException e) {
            logger.error("[Config] Error loading config file {}: {}", file, e.getMessage());
            throw new ConfigException("Error loading config file " + file, e);
        }
        return values;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    /** {@code mq.retry.ttl} → {@code MQ_RETRY_TTL}. */
    public static String envKey(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    /**
     * Gets a configuration value, checking environment variables first, then system properties,
     * the .env file and finally the properties file.
     */
    public String get(String key, String defaultValue) {
        String envKey = envKey(key);
        String envValue = environment.get(envKey);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }

        String sysProp = systemProperties.getProperty(key);
        if (sysProp != null && !sysProp.isBlank()) {
            return sysProp;
        }

        String fileValue = dotEnv.get(envKey);
        if (fileValue != null && !fileValue.isBlank()) {
            return fileValue;
        }

        return properties.getProperty(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("[Config] {} is not an integer ({}); using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("[Config] {} is not a number ({}); using {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return Boolean.parseBoolean(value.trim());
    }

    public List<String> getList(String key, String defaultValue) {
        String value = get(key, defaultValue);
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
