package com.cronium.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches the Cronium configuration file.
 * <p>
 * The file is JSON; {@code ${VAR}} and {@code ${VAR:-default}} references are
 * substituted from the environment before parsing. A missing or unreadable
 * file yields the defaults.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMillis(200);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");

    private final ObjectMapper objectMapper;
    private final Cache<String, CroniumConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath);
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public CroniumConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public CroniumConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    /**
     * Write the given config to disk and drop the cached copy.
     */
    public void saveConfig(CroniumConfig config) throws IOException {
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json);
        cache.invalidateAll();
        log.info("Config saved to: {}", configPath);
    }

    public Path getConfigPath() {
        return configPath;
    }

    private CroniumConfig doLoadConfig() {
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            return applyDefaults(new CroniumConfig());
        }
        try {
            String raw = substituteEnvVars(Files.readString(configPath));
            CroniumConfig config = applyDefaults(objectMapper.readValue(raw, CroniumConfig.class));
            log.info("Config loaded from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to load config from: {}", configPath, e);
            return applyDefaults(new CroniumConfig());
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Fill every missing section with its defaults.
     */
    static CroniumConfig applyDefaults(CroniumConfig config) {
        if (config.getScheduler() == null) {
            config.setScheduler(new CroniumConfig.SchedulerConfig());
        }
        if (config.getSandbox() == null) {
            config.setSandbox(new CroniumConfig.SandboxConfig());
        }
        if (config.getDispatch() == null) {
            config.setDispatch(new CroniumConfig.DispatchConfig());
        }
        if (config.getNotifications() == null) {
            config.setNotifications(new CroniumConfig.NotificationsConfig());
        }
        if (config.getStore() == null) {
            config.setStore(new CroniumConfig.StoreConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new CroniumConfig.LoggingConfig());
        }
        return config;
    }

    /**
     * Expand a leading {@code ~} to the user home directory.
     */
    public static Path expandHome(Path path) {
        String pathStr = path.toString();
        if (pathStr.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        return path;
    }
}
